package com.healthtech.olap.data.run;

public enum RunStatus {
    RUNNING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
