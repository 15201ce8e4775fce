package org.netkat.datamodel.answers;

import com.fasterxml.jackson.core.JsonProcessingException;

public interface AnswerElement {

    String prettyPrint() throws JsonProcessingException;

}
