package com.userintel.common.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.userintel.common.model.BeliefDomain;

/** Structured value of one belief domain. One implementation per {@link BeliefDomain}. */
public interface DomainValue {

    @JsonIgnore
    BeliefDomain domain();
}
