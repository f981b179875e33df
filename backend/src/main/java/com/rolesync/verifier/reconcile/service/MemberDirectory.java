package com.rolesync.verifier.reconcile.service;

import com.rolesync.verifier.reconcile.model.GuildMember;
import com.rolesync.verifier.reconcile.model.Member;

import java.util.List;
import java.util.Optional;

public interface MemberDirectory {
    List<GuildMember> listMembers(String guildId);

    Optional<GuildMember> findMember(Member member);

    boolean roleExists(String guildId, String roleId);
}
