package fr.lapetina.inference.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ModelListResponse(String object, List<Entry> data) {

    public record Entry(
            String id,
            String object,
            long created,
            @JsonProperty("owned_by") String ownedBy
    ) {
    }
}
