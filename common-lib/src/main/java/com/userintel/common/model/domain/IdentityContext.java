package com.userintel.common.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.userintel.common.model.BeliefDomain;

/** Who the user is. Populated only from explicit statements and answers. */
public record IdentityContext(
    @JsonProperty("name")          String name,
    @JsonProperty("preferredName") String preferredName,
    @JsonProperty("role")          String role,
    @JsonProperty("industry")      String industry
) implements DomainValue {

    public static IdentityContext empty() {
        return new IdentityContext(null, null, null, null);
    }

    /** Preferred name when known, otherwise the given name. */
    public String displayName() {
        return preferredName != null ? preferredName : name;
    }

    public IdentityContext withName(String v)          { return new IdentityContext(v, preferredName, role, industry); }
    public IdentityContext withPreferredName(String v) { return new IdentityContext(name, v, role, industry); }
    public IdentityContext withRole(String v)          { return new IdentityContext(name, preferredName, v, industry); }

    @Override
    public BeliefDomain domain() {
        return BeliefDomain.IDENTITY_CONTEXT;
    }
}
