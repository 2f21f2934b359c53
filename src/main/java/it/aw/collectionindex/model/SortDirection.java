package it.aw.collectionindex.model;

public enum SortDirection {
    ASC("asc"),
    DESC("desc");

    private final String key;

    SortDirection(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static SortDirection fromKey(String key) {
        for (SortDirection direction : values()) {
            if (direction.key.equalsIgnoreCase(key)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Direzione di ordinamento sconosciuta: " + key);
    }
}
