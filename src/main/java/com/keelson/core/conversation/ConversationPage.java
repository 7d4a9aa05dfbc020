package com.keelson.core.conversation;

import java.util.List;

/**
 * A contiguous slice {@code [entriesStart, entriesStart + entries.size())} of a conversation log.
 *
 * @param entries      the entries in log order
 * @param entriesTotal log length at the time the page was cut
 * @param entriesStart position of the first entry; pass it as {@code before} to fetch older entries
 */
public record ConversationPage(
    List<ConversationEntry> entries,
    int entriesTotal,
    int entriesStart
) {
    public ConversationPage {
        entries = List.copyOf(entries);
    }

    public boolean truncated() {
        return entriesStart > 0;
    }
}
