package com.stpa.coverage.model;

public record ControllerStep(String controllerId, Movement movement) {}
