package dev.makefmt.parser;

/**
 * Fields of comments, section headers and banners.
 *
 * @param prefix the comment marker preserved by the writer: {@code #}, {@code ##} or {@code ##@};
 *               empty for banners, whose whole text is kept in {@code text}
 * @param text   the text after the prefix, trimmed
 * @param inline whether the comment trails other content on the same line
 */
public record CommentFields(String prefix, String text, boolean inline) implements NodeFields {

    public CommentFields {
        prefix = prefix == null ? "" : prefix;
        text = text == null ? "" : text;
    }

    public CommentFields withText(String text) {
        return new CommentFields(prefix, text, inline);
    }

    @Override
    public CommentFields copy() {
        return new CommentFields(prefix, text, inline);
    }
}
