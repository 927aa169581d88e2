package de.t14d3.dbexecutor.query;

/**
 * How statement text is sent to the database.
 */
public enum CommandType {
    /** Ad hoc SQL text. */
    TEXT,
    /** The name of a stored procedure. */
    STORED_PROCEDURE;

    /**
     * A single word is taken to be a procedure name, anything containing
     * whitespace is SQL text.
     */
    public static CommandType detect(String procedureNameOrQuery) {
        if (procedureNameOrQuery == null || procedureNameOrQuery.isBlank()) {
            throw new IllegalArgumentException("Statement text must not be blank");
        }
        String text = procedureNameOrQuery.trim();
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return TEXT;
            }
        }
        return STORED_PROCEDURE;
    }
}
