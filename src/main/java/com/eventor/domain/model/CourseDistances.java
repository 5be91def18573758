package com.eventor.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Course lengths of one race, scraped from its public result page.
 *
 * @param metersByClass     course length in meters by class name, in page order
 * @param unmatchedClasses  classes whose header carried no recognisable length
 */
public record CourseDistances(
    Map<String, Integer> metersByClass,
    List<String> unmatchedClasses
) {

    public CourseDistances {
        metersByClass = Collections.unmodifiableMap(new LinkedHashMap<>(metersByClass));
        unmatchedClasses = List.copyOf(unmatchedClasses);
    }
}
