package org.carball.sqladvisor.error;

import lombok.Getter;
import org.carball.sqladvisor.model.fact.AdvisoryFact;

@Getter
public class InvalidFactException extends AdvisorException {

    private final AdvisoryFact fact;

    public InvalidFactException(AdvisoryFact fact, String reason) {
        super(reason + ": " + fact);
        this.fact = fact;
    }
}
