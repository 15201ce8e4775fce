package org.netkat.smt.answers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.netkat.common.util.NetKatObjectMapper;
import org.netkat.datamodel.answers.AnswerElement;
import org.netkat.smt.VerificationResult;

import java.util.Map;
import java.util.TreeMap;


/**
 * The results of a batch of named reachability checks.
 */
public class SmtReachabilityAnswerElement implements AnswerElement {

    private static final String RESULT_VAR = "result";

    private Map<String, VerificationResult> _result;

    public SmtReachabilityAnswerElement() {
        _result = new TreeMap<>();
    }

    @JsonCreator
    public SmtReachabilityAnswerElement(
            @JsonProperty(RESULT_VAR) Map<String, VerificationResult> result) {
        _result = (result == null ? new TreeMap<>() : new TreeMap<>(result));
    }

    public void addResult(VerificationResult res) {
        _result.put(res.getName(), res);
    }

    @JsonProperty(RESULT_VAR)
    public Map<String, VerificationResult> getResult() {
        return _result;
    }

    /**
     * Whether every check in the batch passed.
     */
    public boolean allPassed() {
        for (VerificationResult res : _result.values()) {
            if (!res.getPassed()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String prettyPrint() throws JsonProcessingException {
        ObjectMapper mapper = new NetKatObjectMapper();
        return mapper.writeValueAsString(this);
    }
}
