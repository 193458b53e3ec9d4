package com.itguru.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ModelSelection(@NotBlank String model) {}
