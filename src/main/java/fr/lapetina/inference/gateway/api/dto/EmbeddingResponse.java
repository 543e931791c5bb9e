package fr.lapetina.inference.gateway.api.dto;

import java.util.List;

public record EmbeddingResponse(
        String object,
        List<Item> data,
        String model,
        Usage usage
) {
    public record Item(String object, List<Double> embedding, int index) {

        public static Item of(List<Double> embedding, int index) {
            return new Item("embedding", embedding, index);
        }
    }
}
