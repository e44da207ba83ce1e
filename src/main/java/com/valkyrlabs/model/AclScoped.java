package com.valkyrlabs.model;

/**
 * Anything that carries an optional ACL reference. {@code null} means public.
 */
public interface AclScoped {

    Long getAclId();
}
