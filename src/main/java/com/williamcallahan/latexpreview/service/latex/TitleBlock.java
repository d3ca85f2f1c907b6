package com.williamcallahan.latexpreview.service.latex;

import java.util.Objects;
import java.util.Optional;

/**
 * Title block fields as LaTeX source, before inline formatting.
 *
 * @param title {@code \title} argument
 * @param author {@code \author} argument with {@code \and} joined and {@code \thanks} removed
 * @param date {@code \date} argument with {@code \today} resolved
 */
record TitleBlock(Optional<String> title, Optional<String> author, Optional<String> date) {

    TitleBlock {
        Objects.requireNonNull(title, "Title cannot be null");
        Objects.requireNonNull(author, "Author cannot be null");
        Objects.requireNonNull(date, "Date cannot be null");
    }

    static TitleBlock none() {
        return new TitleBlock(Optional.empty(), Optional.empty(), Optional.empty());
    }

    boolean isEmpty() {
        return title.isEmpty() && author.isEmpty() && date.isEmpty();
    }
}
