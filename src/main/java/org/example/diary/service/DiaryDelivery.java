package org.example.diary.service;

import org.example.diary.model.ReadingContent;

/**
 * Hands a finished diary entry to whatever sends or stores it.
 */
public interface DiaryDelivery {

    /**
     * @return true if the entry was delivered
     */
    boolean deliver(ReadingContent reading, String diaryText);
}
