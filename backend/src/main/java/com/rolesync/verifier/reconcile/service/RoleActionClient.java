package com.rolesync.verifier.reconcile.service;

import com.rolesync.verifier.reconcile.model.Member;
import com.rolesync.verifier.reconcile.model.RoleActionResult;

/**
 * Adds or removes one role on one member. Both calls succeed when the member is already in the
 * requested state.
 */
public interface RoleActionClient {
    RoleActionResult grant(Member member, String roleId);

    RoleActionResult revoke(Member member, String roleId);
}
