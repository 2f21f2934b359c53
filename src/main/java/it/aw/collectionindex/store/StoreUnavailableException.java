package it.aw.collectionindex.store;

/**
 * Lo store dell'indice non è raggiungibile. Categoria distinta e ritentabile:
 * il writer ritenta, il rebuild si ferma e riporta l'avanzamento parziale.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreUnavailableException(String message) {
        super(message);
    }
}
