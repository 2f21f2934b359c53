package it.aw.collectionindex.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Serializzazione JSON dei record memorizzati nello store (summary, stato, dashboard).
 */
@Component
public class IndexJson {

    private final ObjectMapper objectMapper;

    public IndexJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Errore serializzazione " + value.getClass().getSimpleName(), e);
        }
    }

    public <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Errore deserializzazione " + type.getSimpleName(), e);
        }
    }

    public <T> Optional<T> readOptional(String json, Class<T> type) {
        return json == null ? Optional.empty() : Optional.of(read(json, type));
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
