package org.netkat.smt;


import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The outcome of one reachability check: the solver's verdict, the oracle
 * it was compared against, and where the program was written when they
 * disagree.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationResult {

    private static final String NAME_VAR = "name";

    private static final String SATISFIABLE_VAR = "satisfiable";

    private static final String EXPECTED_VAR = "expected";

    private static final String HOP_BOUND_VAR = "hopBound";

    private static final String REPRODUCTION_FILE_VAR = "reproductionFile";

    private static final String STATISTICS_VAR = "statistics";

    private String _name;

    private boolean _satisfiable;

    private Boolean _expected;

    private int _hopBound;

    private String _reproductionFile;

    private VerificationStats _statistics;

    @JsonCreator
    public VerificationResult(
            @JsonProperty(NAME_VAR) String name,
            @JsonProperty(SATISFIABLE_VAR) boolean satisfiable,
            @JsonProperty(EXPECTED_VAR) Boolean expected,
            @JsonProperty(HOP_BOUND_VAR) int hopBound,
            @JsonProperty(REPRODUCTION_FILE_VAR) String reproductionFile,
            @JsonProperty(STATISTICS_VAR) VerificationStats statistics) {
        _name = name;
        _satisfiable = satisfiable;
        _expected = expected;
        _hopBound = hopBound;
        _reproductionFile = reproductionFile;
        _statistics = statistics;
    }

    @JsonProperty(NAME_VAR)
    public String getName() {
        return _name;
    }

    @JsonProperty(SATISFIABLE_VAR)
    public boolean getSatisfiable() {
        return _satisfiable;
    }

    @JsonProperty(EXPECTED_VAR)
    public Boolean getExpected() {
        return _expected;
    }

    /**
     * Whether the verdict matches the oracle. Without an oracle the check
     * passes exactly when the query is satisfiable.
     */
    @JsonProperty("passed")
    public boolean getPassed() {
        if (_expected == null) {
            return _satisfiable;
        }
        return _expected == _satisfiable;
    }

    @JsonProperty(HOP_BOUND_VAR)
    public int getHopBound() {
        return _hopBound;
    }

    @JsonProperty(REPRODUCTION_FILE_VAR)
    public String getReproductionFile() {
        return _reproductionFile;
    }

    @JsonProperty(STATISTICS_VAR)
    public VerificationStats getStatistics() {
        return _statistics;
    }

}
