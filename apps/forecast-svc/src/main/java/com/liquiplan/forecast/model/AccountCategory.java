package com.liquiplan.forecast.model;

public record AccountCategory(String name, CashflowDirection direction, String color) {
}
