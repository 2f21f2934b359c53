package it.aw.collectionindex.index;

import it.aw.collectionindex.model.CollectionSummary;
import it.aw.collectionindex.model.SortDirection;
import it.aw.collectionindex.model.SortField;

import java.util.Locale;

/**
 * Converte gli attributi ordinabili di un summary in elementi di sorted set.
 * <p>
 * Convenzione unica: la direzione è codificata nell'elemento memorizzato e tutte
 * le letture usano il rank crescente. I campi numerici usano lo score (negato per
 * DESC) e l'id come member. Il nome usa score 0 e un member lessicografico:
 * ogni unità UTF-16 del nome in minuscolo diventa 4 cifre esadecimali
 * (complementate a 0xFFFF per DESC), seguite dal separatore e dall'id.
 * Il separatore ASC {@code '!'} precede ogni cifra esadecimale e quello DESC
 * {@code '~'} le segue, così un prefisso ordina correttamente in entrambe le direzioni.
 * A parità di chiave l'ordine è per id.
 */
public final class ScoreCodec {

    static final char ASC_SEPARATOR  = '!';
    static final char DESC_SEPARATOR = '~';

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private ScoreCodec() {}

    public static IndexEntry entryFor(CollectionSummary summary, SortField field, SortDirection direction) {
        if (field.isLexical()) {
            return new IndexEntry(0, nameMember(summary.name(), summary.id(), direction));
        }
        double score = numericScore(summary, field);
        return new IndexEntry(direction == SortDirection.DESC ? -score : score, summary.id());
    }

    static double numericScore(CollectionSummary summary, SortField field) {
        return switch (field) {
            case UPDATED_AT -> summary.updatedAt() == null ? 0 : summary.updatedAt().toEpochMilli();
            case CREATED_AT -> summary.createdAt() == null ? 0 : summary.createdAt().toEpochMilli();
            case IMAGE_COUNT -> summary.imageCount();
            case TOTAL_SIZE -> summary.totalSize();
            case NAME -> throw new IllegalArgumentException("Il nome non ha uno score numerico");
        };
    }

    /** Chiave lessicografica del nome, senza id: stesso ordine del nome normalizzato. */
    public static String nameKey(String name, SortDirection direction) {
        String normalized = name == null ? "" : name.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(normalized.length() * 4 + 1);
        for (int i = 0; i < normalized.length(); i++) {
            int unit = normalized.charAt(i);
            if (direction == SortDirection.DESC) {
                unit = 0xFFFF - unit;
            }
            sb.append(HEX[(unit >> 12) & 0xF])
              .append(HEX[(unit >> 8) & 0xF])
              .append(HEX[(unit >> 4) & 0xF])
              .append(HEX[unit & 0xF]);
        }
        sb.append(direction == SortDirection.DESC ? DESC_SEPARATOR : ASC_SEPARATOR);
        return sb.toString();
    }

    static String nameMember(String name, String id, SortDirection direction) {
        return nameKey(name, direction) + id;
    }

    /** Id della collection a partire da un member di qualsiasi sorted set. */
    public static String idOf(String member, SortField field) {
        if (!field.isLexical()) {
            return member;
        }
        // la parte esadecimale non contiene mai i separatori: il primo trovato è quello giusto
        for (int i = 0; i < member.length(); i++) {
            char c = member.charAt(i);
            if (c == ASC_SEPARATOR || c == DESC_SEPARATOR) {
                return member.substring(i + 1);
            }
        }
        return member;
    }
}
