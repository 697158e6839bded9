package com.example.jejutrip.exception;

import lombok.Getter;

import java.time.LocalDate;

@Getter
public class DayPlanningException extends RuntimeException {

    private final int dayNumber;
    private final LocalDate date;
    private final ExternalDependency dependency;

    public DayPlanningException(int dayNumber, LocalDate date, ExternalServiceException cause) {
        super("day " + dayNumber + " (" + date + ") failed on " + cause.getDependency()
                + ": " + cause.getMessage(), cause);
        this.dayNumber = dayNumber;
        this.date = date;
        this.dependency = cause.getDependency();
    }
}
