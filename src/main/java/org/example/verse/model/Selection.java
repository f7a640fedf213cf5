package org.example.verse.model;

import java.time.LocalDate;

public record Selection(LocalDate date, Verse verse) {}
