package io.b2mash.yahrzeit.subject.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import java.time.LocalDate;

public record ChangeDeathDateRequest(@NotNull @PastOrPresent LocalDate deathDate) {}
