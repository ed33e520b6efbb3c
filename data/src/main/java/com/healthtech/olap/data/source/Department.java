package com.healthtech.olap.data.source;

public record Department(int departmentId, String departmentName, Integer floor, Integer capacity) {
}
