package it.aw.collectionindex.model;

import java.util.Locale;

/**
 * Tipo di una collection: cartella su disco o archivio compresso.
 * <p>
 * La chiave testuale ({@link #key()}) compare nei nomi degli indici per tipo
 * ({@code collection_index:sorted:by_type:{key}:...}) e nei parametri REST.
 */
public enum CollectionType {
    FOLDER,
    ZIP,
    RAR,
    SEVEN_ZIP,
    TAR;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CollectionType fromKey(String key) {
        for (CollectionType type : values()) {
            if (type.key().equalsIgnoreCase(key) || type.name().equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Tipo di collection sconosciuto: " + key);
    }
}
