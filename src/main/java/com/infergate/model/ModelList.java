package com.infergate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelList {

    @JsonProperty("object")
    private String object = "list";

    @JsonProperty("data")
    private List<ModelInfo> data;

    public static ModelList of(ModelInfo model) {
        return new ModelList("list", List.of(model));
    }
}
