package it.aw.collectionindex.model;

/**
 * Campi di ordinamento dell'indice. Per ogni campo esiste un sorted set per
 * direzione e per scope; aggiungere un campo qui è l'unico punto di modifica,
 * i switch su questo enum sono esaustivi.
 */
public enum SortField {
    UPDATED_AT("updatedAt", false),
    CREATED_AT("createdAt", false),
    NAME("name", true),
    IMAGE_COUNT("imageCount", false),
    TOTAL_SIZE("totalSize", false);

    private final String key;
    private final boolean lexical;

    SortField(String key, boolean lexical) {
        this.key = key;
        this.lexical = lexical;
    }

    /** Nome usato nelle chiavi dello store e nei parametri REST. */
    public String key() {
        return key;
    }

    /** {@code true} se l'ordinamento è lessicografico sul member invece che numerico sullo score. */
    public boolean isLexical() {
        return lexical;
    }

    public static SortField fromKey(String key) {
        for (SortField field : values()) {
            if (field.key.equalsIgnoreCase(key) || field.name().equalsIgnoreCase(key)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Campo di ordinamento sconosciuto: " + key);
    }
}
