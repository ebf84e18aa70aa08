package org.calista.specopt.ai.env;

public enum EnvironmentState {
    UNINITIALIZED,
    READY,
    TERMINAL
}
