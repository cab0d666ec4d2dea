package com.planwright.core.model;

import java.io.Serializable;

public record Risk(
    String description,
    String impact,
    String mitigation
) implements Serializable {}
