package org.netkat.smt;


import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class VerificationStats {

    private static final String NUM_VARIABLES_VAR = "numVariables";

    private static final String NUM_MACROS_VAR = "numMacros";

    private static final String NUM_ASSERTIONS_VAR = "numAssertions";

    private static final String TIME_VAR = "time";

    private int _numVariables;

    private int _numMacros;

    private int _numAssertions;

    private long _time;

    @JsonCreator
    public VerificationStats(
            @JsonProperty(NUM_VARIABLES_VAR) int v,
            @JsonProperty(NUM_MACROS_VAR) int m,
            @JsonProperty(NUM_ASSERTIONS_VAR) int a,
            @JsonProperty(TIME_VAR) long t) {
        _numVariables = v;
        _numMacros = m;
        _numAssertions = a;
        _time = t;
    }

    @JsonProperty(NUM_VARIABLES_VAR)
    public int getNumVariables() {
        return _numVariables;
    }

    @JsonProperty(NUM_MACROS_VAR)
    public int getNumMacros() {
        return _numMacros;
    }

    @JsonProperty(NUM_ASSERTIONS_VAR)
    public int getNumAssertions() {
        return _numAssertions;
    }

    @JsonProperty(TIME_VAR)
    public long getTime() {
        return _time;
    }

}
