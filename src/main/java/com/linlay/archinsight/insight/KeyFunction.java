package com.linlay.archinsight.insight;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyFunction(String name, String desc, String inputs, String outputs) {

    public KeyFunction {
        name = name == null ? "" : name;
        desc = desc == null ? "" : desc;
    }
}
