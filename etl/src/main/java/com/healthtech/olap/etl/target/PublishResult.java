package com.healthtech.olap.etl.target;

public record PublishResult(int rowsDeleted, int rowsInserted) {
}
