package com.eventor.infrastructure.xml;

import com.eventor.domain.mapping.SearchMode;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Tracks which children of one element have already been bound during a decode.
 */
final class ChildCursor {

    private final List<Element> children;
    private final boolean[] consumed;
    private final SearchMode mode;
    private int next;
    private int entered = -1;

    ChildCursor(List<Element> children, SearchMode mode) {
        this.children = children;
        this.consumed = new boolean[children.size()];
        this.mode = mode;
    }

    /**
     * Binds the next child with the given tag, or returns {@code null}.
     */
    Element take(String tag) {
        if (mode == SearchMode.ORDERED) {
            for (int i = next; i < children.size(); i++) {
                if (matches(i, tag)) {
                    next = i + 1;
                    return children.get(i);
                }
            }
            return null;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!consumed[i] && matches(i, tag)) {
                consumed[i] = true;
                return children.get(i);
            }
        }
        return null;
    }

    /**
     * Binds every remaining child with the given tag, in document order.
     */
    List<Element> takeAll(String tag) {
        List<Element> matched = new ArrayList<>();
        Element element;
        while ((element = take(tag)) != null) {
            matched.add(element);
        }
        return matched;
    }

    /**
     * Finds a wrapper element. Wrappers are shared between fields, so in ordered mode the
     * search starts one step back when the previous field entered that child as a wrapper.
     * A child bound by {@link #take(String)} is never entered again.
     */
    Element enter(String tag) {
        if (mode == SearchMode.ORDERED) {
            int from = entered >= 0 && entered == next - 1 ? entered : next;
            for (int i = from; i < children.size(); i++) {
                if (matches(i, tag)) {
                    next = i + 1;
                    entered = i;
                    return children.get(i);
                }
            }
            return null;
        }
        for (int i = 0; i < children.size(); i++) {
            if (matches(i, tag)) {
                return children.get(i);
            }
        }
        return null;
    }

    private boolean matches(int index, String tag) {
        return children.get(index).tagName().equals(tag);
    }
}
