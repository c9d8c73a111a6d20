package com.vespasync.sync.identity;

/**
 * A source record could not be mapped onto the target model, either because a
 * required field is missing or because it references an identity that is not known.
 */
public class MappingException extends Exception {
    private final String category;

    public MappingException(String category, String message) {
        super(message);
        this.category = category == null || category.isBlank() ? "mapping" : category;
    }

    public String category() {
        return category;
    }
}
