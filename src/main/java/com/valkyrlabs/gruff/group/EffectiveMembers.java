package com.valkyrlabs.gruff.group;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Transitive membership of one group: each user once, with every path by which
 * it is reached, and each nested group with the path to it.
 */
public class EffectiveMembers {

    private final List<EffectiveUser> users;
    private final List<EffectiveGroup> groups;

    public EffectiveMembers(List<EffectiveUser> users, List<EffectiveGroup> groups) {
        this.users = List.copyOf(users);
        this.groups = List.copyOf(groups);
    }

    public List<EffectiveUser> getUsers() {
        return users;
    }

    public List<EffectiveGroup> getGroups() {
        return groups;
    }

    public int getTotalUsers() {
        return users.size();
    }

    public int getTotalGroups() {
        return groups.size();
    }

    public static class EffectiveUser {
        private final UUID userId;
        private final String name;
        private final String email;
        private final List<List<UUID>> paths = new ArrayList<>();

        public EffectiveUser(UUID userId, String name, String email) {
            this.userId = userId;
            this.name = name;
            this.email = email;
        }

        public UUID getUserId() {
            return userId;
        }

        public String getName() {
            return name;
        }

        public String getEmail() {
            return email;
        }

        public List<List<UUID>> getPaths() {
            return paths;
        }

        void addPath(List<UUID> path) {
            paths.add(path);
        }
    }

    public static class EffectiveGroup {
        private final UUID groupId;
        private final String name;
        private final List<UUID> path;

        public EffectiveGroup(UUID groupId, String name, List<UUID> path) {
            this.groupId = groupId;
            this.name = name;
            this.path = path;
        }

        public UUID getGroupId() {
            return groupId;
        }

        public String getName() {
            return name;
        }

        public List<UUID> getPath() {
            return path;
        }
    }
}
