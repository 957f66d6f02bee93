package com.lsemantica.core.lsdoc;

/**
 * A span of source text. Lines and columns are 1-based; offsets are 0-based.
 */
public record SourceRange(Position start, Position end) {

    public record Position(int offset, int line, int column) {}

    static SourceRange between(Position start, Position end) {
        return new SourceRange(start, end);
    }

    static SourceRange at(Position position) {
        return new SourceRange(position, position);
    }
}
