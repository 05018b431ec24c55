package org.example.diary;

import org.example.diary.scripture.ReferenceResolver;
import org.example.diary.service.DailyDiaryService;
import org.example.diary.service.DiaryDelivery;
import org.example.diary.service.GenerationPipeline;
import org.example.diary.service.PromptAssembler;
import org.example.diary.service.llm.LlmProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "scripture.enrichment.enabled=false",
        "ai.diary.provider=ollama"
})
class DiaryApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    @Qualifier("diaryLlmProvider")
    private LlmProvider diaryLlmProvider;

    @Test
    void contextLoadsWithoutReferenceCorpus() {
        assertNotNull(context.getBean(DailyDiaryService.class));
        assertNotNull(context.getBean(GenerationPipeline.class));
        assertNotNull(context.getBean(PromptAssembler.class));
        assertNotNull(context.getBean(DiaryDelivery.class));
        assertEquals("ollama", diaryLlmProvider.getProviderName());
        assertTrue(context.getBeansOfType(ReferenceResolver.class).isEmpty());
    }
}
