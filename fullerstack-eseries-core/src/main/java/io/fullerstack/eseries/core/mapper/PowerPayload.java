package io.fullerstack.eseries.core.mapper;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Power supply response in one of its two upstream shapes: an object or a
 * single-element list wrapping that object.
 */
public sealed interface PowerPayload permits PowerPayload.Single, PowerPayload.Wrapped {

    String ENERGY_STAR_FIELD = "energyStarData";

    record Single(JsonNode body) implements PowerPayload {
        public Single {
            Objects.requireNonNull(body, "body cannot be null");
        }
    }

    record Wrapped(JsonNode list) implements PowerPayload {
        public Wrapped {
            Objects.requireNonNull(list, "list cannot be null");
        }
    }

    static PowerPayload from(JsonNode response) {
        Objects.requireNonNull(response, "response cannot be null");
        if (response.isArray()) {
            return new Wrapped(response);
        }
        if (response.isObject()) {
            return new Single(response);
        }
        throw new IllegalArgumentException("Unsupported power payload: " + response.getNodeType());
    }

    /**
     * The record holding {@code totalPower}: the {@code energyStarData} object when present,
     * else the body itself. Empty for an empty list.
     */
    default Optional<JsonNode> energyRecord() {
        JsonNode body;
        if (this instanceof Single single) {
            body = single.body();
        } else {
            JsonNode list = ((Wrapped) this).list();
            if (list.isEmpty()) {
                return Optional.empty();
            }
            body = list.get(0);
        }
        JsonNode energy = body.path(ENERGY_STAR_FIELD);
        return Optional.of(energy.isObject() ? energy : body);
    }
}
