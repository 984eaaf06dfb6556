package dev.makefmt.diff;

import java.util.Objects;

/**
 * One step of an edit script.
 *
 * @param kind     operation
 * @param oldIndex 0-based index into the old sequence, -1 for inserts
 * @param newIndex 0-based index into the new sequence, -1 for deletes
 */
public record Edit(EditKind kind, int oldIndex, int newIndex) {

    public Edit {
        Objects.requireNonNull(kind, "kind");
    }

    public static Edit equal(int oldIndex, int newIndex) {
        return new Edit(EditKind.EQUAL, oldIndex, newIndex);
    }

    public static Edit insert(int newIndex) {
        return new Edit(EditKind.INSERT, -1, newIndex);
    }

    public static Edit delete(int oldIndex) {
        return new Edit(EditKind.DELETE, oldIndex, -1);
    }

    public boolean isChange() {
        return kind != EditKind.EQUAL;
    }
}
