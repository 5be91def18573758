package com.eventor.domain.model;

import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.SearchMode;
import com.eventor.domain.mapping.XmlEntity;

import java.util.List;

/**
 * Result lists of every event a person took part in within a period.
 */
@XmlEntity(tag = "ResultListList", searchMode = SearchMode.ORDERED)
public record ResultListList(
    @Element("ResultList") List<ResultList> resultLists
) {

    public ResultListList {
        resultLists = List.copyOf(resultLists);
    }
}
