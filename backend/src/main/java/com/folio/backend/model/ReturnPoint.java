package com.folio.backend.model;

import java.time.LocalDate;

public record ReturnPoint(LocalDate date, double value) {}
