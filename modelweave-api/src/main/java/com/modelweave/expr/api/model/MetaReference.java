/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MetaReference(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("target") String target,
        @JsonProperty("multiValued") boolean multiValued
) {}
