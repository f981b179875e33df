package com.rolesync.verifier.reconcile.service;

import com.rolesync.verifier.reconcile.http.DiscordApiException;
import com.rolesync.verifier.reconcile.model.GuildConfig;
import com.rolesync.verifier.reconcile.model.GuildMember;
import com.rolesync.verifier.reconcile.model.Member;
import com.rolesync.verifier.reconcile.model.RoleActionResult;
import com.rolesync.verifier.reconcile.model.VerificationStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-memory stand-ins for the engine's outbound ports. All of them are safe to call from worker
 * threads.
 */
final class FakeReconcileCollaborators {
    private FakeReconcileCollaborators() {}

    static GuildMember guildMember(String guildId, String userId, String... roleIds) {
        return new GuildMember(new Member(guildId, userId), Set.of(roleIds));
    }

    static final class FakeLookupClient implements VerificationLookupClient {
        private final Map<String, VerificationStatus> statuses = new ConcurrentHashMap<>();
        private final List<Member> lookups = new ArrayList<>();
        private volatile Consumer<Member> beforeReturn = member -> {};

        void status(String userId, VerificationStatus status) {
            statuses.put(userId, status);
        }

        void beforeReturn(Consumer<Member> hook) {
            this.beforeReturn = hook;
        }

        synchronized List<Member> lookups() {
            return List.copyOf(lookups);
        }

        @Override
        public VerificationStatus lookup(Member member) {
            synchronized (this) {
                lookups.add(member);
            }
            beforeReturn.accept(member);
            return statuses.getOrDefault(member.userId(), VerificationStatus.NOT_VERIFIED);
        }
    }

    static final class RecordingRoleActionClient implements RoleActionClient {
        private final Map<String, RoleActionResult> results = new ConcurrentHashMap<>();
        private final List<String> calls = new ArrayList<>();

        void result(String userId, RoleActionResult result) {
            results.put(userId, result);
        }

        synchronized List<String> calls() {
            return List.copyOf(calls);
        }

        @Override
        public RoleActionResult grant(Member member, String roleId) {
            return call("grant", member, roleId);
        }

        @Override
        public RoleActionResult revoke(Member member, String roleId) {
            return call("revoke", member, roleId);
        }

        private RoleActionResult call(String action, Member member, String roleId) {
            synchronized (this) {
                calls.add(action + ":" + member.userId() + ":" + roleId);
            }
            return results.getOrDefault(member.userId(), RoleActionResult.ok());
        }
    }

    static final class InMemoryMemberDirectory implements MemberDirectory {
        private final Map<String, List<GuildMember>> members = new HashMap<>();
        private volatile boolean listFails;
        private volatile boolean roleExists = true;
        private int findCalls;

        synchronized void add(GuildMember member) {
            members.computeIfAbsent(member.member().guildId(), g -> new ArrayList<>()).add(member);
        }

        void listFails(boolean fails) {
            this.listFails = fails;
        }

        void roleExists(boolean exists) {
            this.roleExists = exists;
        }

        synchronized int findCalls() {
            return findCalls;
        }

        @Override
        public synchronized List<GuildMember> listMembers(String guildId) {
            if (listFails) {
                throw new DiscordApiException("Failed to read member list for guild " + guildId + ": http_500", 500);
            }
            return List.copyOf(members.getOrDefault(guildId, List.of()));
        }

        @Override
        public synchronized Optional<GuildMember> findMember(Member member) {
            findCalls++;
            return members.getOrDefault(member.guildId(), List.of()).stream()
                .filter(candidate -> candidate.member().equals(member))
                .findFirst();
        }

        @Override
        public boolean roleExists(String guildId, String roleId) {
            return roleExists;
        }
    }

    static final class InMemoryGuildConfigStore implements GuildConfigStore {
        private final Map<String, GuildConfig> configs = new ConcurrentHashMap<>();

        void put(GuildConfig config) {
            configs.put(config.guildId(), config);
        }

        void remove(String guildId) {
            configs.remove(guildId);
        }

        @Override
        public Optional<GuildConfig> find(String guildId) {
            return Optional.ofNullable(configs.get(guildId));
        }
    }
}
