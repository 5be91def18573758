package com.eventor.domain.model;

import com.eventor.domain.mapping.Element;
import com.eventor.domain.mapping.SearchMode;
import com.eventor.domain.mapping.Wrapped;
import com.eventor.domain.mapping.XmlEntity;

import java.util.List;

/**
 * Outcome of one competitor in one race.
 *
 * @param time     elapsed time as written by Eventor, e.g. {@code 25:31}
 * @param timeDiff time behind the winner
 * @param position finishing position, absent for competitors who are not ranked
 * @param status   competitor status code such as {@code OK} or {@code MisPunch}
 * @param splits   punches in sequence order
 */
@XmlEntity(searchMode = SearchMode.ORDERED)
public record Result(
    @Element("ResultId") int resultId,
    @Element(value = "StartTime", optional = true) EventDate startTime,
    @Element(value = "FinishTime", optional = true) EventDate finishTime,
    @Element(value = "Time", optional = true) String time,
    @Element(value = "TimeDiff", optional = true) String timeDiff,
    @Element(value = "ResultPosition", optional = true) Integer position,
    @Wrapped(value = "CompetitorStatus", attribute = "value", optional = true) String status,
    @Element("SplitTime") List<Split> splits
) {

    public Result {
        splits = List.copyOf(splits);
    }

    public boolean isRanked() {
        return position != null;
    }
}
