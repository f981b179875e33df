package com.rolesync.verifier.reconcile.service;

import com.rolesync.verifier.reconcile.model.Member;
import com.rolesync.verifier.reconcile.model.VerificationStatus;

public interface VerificationLookupClient {
    VerificationStatus lookup(Member member);
}
