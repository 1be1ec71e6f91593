package com.pocket.config;

import com.pocket.remote.Remote;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** [remote] 段：默认远端与全部远端。 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RemoteConfig {
    private String defaultRemote;
    private List<Remote> remotes = new ArrayList<>();

    public Optional<Remote> find(String name) {
        return remotes.stream().filter(r -> r.getName().equals(name)).findFirst();
    }
}
