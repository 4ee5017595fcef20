package com.gt.lse.interaction;

import com.gt.lse.model.QueuedItem;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

// Due items first (earliest due, then least stable), followed by items that are not due yet, least stable first.
public final class QueueOrdering {

    private QueueOrdering() { }

    public static Comparator<QueuedItem> at(Instant now) {
        Comparator<QueuedItem> dueFirst = Comparator.comparing(queuedItem -> !queuedItem.isDue(now));

        return dueFirst.thenComparing((first, second) -> first.isDue(now)
                ? compareDue(first, second)
                : compareNotDue(first, second));
    }

    public static List<QueuedItem> sort(Collection<QueuedItem> queuedItems, Instant now) {
        List<QueuedItem> sorted = new ArrayList<>(queuedItems);
        sorted.sort(at(now));
        return sorted;
    }

    private static int compareDue(QueuedItem first, QueuedItem second) {
        int result = compareNextDue(first, second);
        if (result == 0) {
            result = Double.compare(first.stabilityDays(), second.stabilityDays());
        }
        return result != 0 ? result : first.itemId().compareTo(second.itemId());
    }

    private static int compareNotDue(QueuedItem first, QueuedItem second) {
        int result = Double.compare(first.stabilityDays(), second.stabilityDays());
        if (result == 0) {
            result = compareNextDue(first, second);
        }
        return result != 0 ? result : first.itemId().compareTo(second.itemId());
    }

    // Never-reviewed items have no due time and sort ahead of everything else
    private static int compareNextDue(QueuedItem first, QueuedItem second) {
        if (first.nextDue() == null || second.nextDue() == null) {
            return first.nextDue() == null ? (second.nextDue() == null ? 0 : -1) : 1;
        }
        return first.nextDue().compareTo(second.nextDue());
    }
}
