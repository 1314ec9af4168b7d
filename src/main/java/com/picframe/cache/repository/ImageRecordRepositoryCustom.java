package com.picframe.cache.repository;

import com.picframe.cache.model.SqlCondition;

import java.util.List;

public interface ImageRecordRepositoryCustom {

    /**
     * Placeholder id returned by {@link #findFileIdsMaskingPortraits} where a portrait row sits.
     */
    long PORTRAIT_SLOT = -1L;

    /**
     * File ids of all rows matching the filter, in the given order.
     */
    List<Long> findFileIds(SqlCondition filter, String orderBy);

    /**
     * Same rows and order as {@link #findFileIds}, with portrait rows replaced by {@link #PORTRAIT_SLOT}.
     */
    List<Long> findFileIdsMaskingPortraits(SqlCondition filter, String orderBy);

    /**
     * File ids of the portrait rows matching the filter, in the given order.
     */
    List<Long> findPortraitFileIds(SqlCondition filter, String orderBy);
}
