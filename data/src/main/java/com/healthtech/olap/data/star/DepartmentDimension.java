package com.healthtech.olap.data.star;

public record DepartmentDimension(int departmentKey, int departmentId, String departmentName, Integer floor, Integer capacity) {
}
