package com.nilsson.promptsyntax.model;

/**
 <h2>ParsingException</h2>
 <p>
 Raised when an explicit prompt operator ({@code .blend()}, {@code .and()}, {@code .swap()}) is used
 with inconsistent arguments, or when a tree node is constructed with an invalid shape.
 </p>
 <p>
 The {@link #getNear()} value holds the offending input text (or operator) so that a user-facing
 tool can report "invalid prompt syntax near ...". Ordinary malformed text never raises this
 exception; it is kept as literal text instead.
 </p>
 */
public class ParsingException extends RuntimeException {

    private final String near;

    public ParsingException(String message) {
        this(message, null);
    }

    public ParsingException(String message, String near) {
        super(message);
        this.near = near;
    }

    /**
     @return the input fragment the problem was detected at, or {@code null} if the error
     came from constructing a node directly.
     */
    public String getNear() {
        return near;
    }
}
