package com.williamcallahan.latexpreview.domain.latex;

/**
 * Title block fields read from a document, as plain text.
 *
 * @param title document title, empty when absent
 * @param author author list joined with commas, empty when absent
 * @param date date line with {@code \today} resolved, empty when absent
 */
public record DocumentMetadata(String title, String author, String date) {

    public DocumentMetadata {
        title = title == null ? "" : title;
        author = author == null ? "" : author;
        date = date == null ? "" : date;
    }

    public static DocumentMetadata none() {
        return new DocumentMetadata("", "", "");
    }

    /**
     * Indicates whether no title block field was found.
     *
     * @return true when every field is blank
     */
    public boolean isEmpty() {
        return title.isBlank() && author.isBlank() && date.isBlank();
    }
}
