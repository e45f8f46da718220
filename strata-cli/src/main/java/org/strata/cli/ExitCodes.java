package org.strata.cli;

final class ExitCodes {
    static final int OK = 0;
    static final int FAILURE = 1;
    static final int GRAPH_ERROR = 2;
    static final int LOCK_HELD = 3;

    private ExitCodes() {
    }
}
