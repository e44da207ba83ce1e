package com.valkyrlabs.gruff.acl;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An ACL entry with the principal's display details, for rendering.
 * {@code principalName} and {@code principalEmail} are {@code null} when the
 * principal no longer exists.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnrichedAclGrant {

    private final AclGrant grant;
    private final String principalName;
    private final String principalEmail;

    public EnrichedAclGrant(AclGrant grant, String principalName, String principalEmail) {
        this.grant = grant;
        this.principalName = principalName;
        this.principalEmail = principalEmail;
    }

    public AclGrant getGrant() {
        return grant;
    }

    @JsonProperty("principal_name")
    public String getPrincipalName() {
        return principalName;
    }

    @JsonProperty("principal_email")
    public String getPrincipalEmail() {
        return principalEmail;
    }
}
