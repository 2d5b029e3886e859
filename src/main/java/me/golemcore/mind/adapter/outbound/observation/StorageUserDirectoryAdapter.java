package me.golemcore.mind.adapter.outbound.observation;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.mind.infrastructure.config.MindProperties;
import me.golemcore.mind.port.outbound.StoragePort;
import me.golemcore.mind.port.outbound.UserDirectoryPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Users are the owners of a knowledge or observation directory in the
 * workspace.
 */
@Component
public class StorageUserDirectoryAdapter implements UserDirectoryPort {

    private static final Pattern USER_ID = Pattern.compile("[A-Za-z0-9._@-]+");

    private final StoragePort storagePort;
    private final List<String> directories;

    public StorageUserDirectoryAdapter(StoragePort storagePort, MindProperties properties) {
        this.storagePort = storagePort;
        MindProperties.StorageProperties storage = properties.getStorage();
        this.directories = List.of(storage.getKnowledgeDirectory(), storage.getObservationsDirectory());
    }

    @Override
    public List<String> listUserIds() {
        TreeSet<String> userIds = new TreeSet<>();
        for (String directory : directories) {
            for (String file : storagePort.listObjects(directory, "").join()) {
                int slash = file.indexOf('/');
                if (slash <= 0) {
                    continue;
                }
                String owner = file.substring(0, slash);
                if (USER_ID.matcher(owner).matches()) {
                    userIds.add(owner);
                }
            }
        }
        return List.copyOf(userIds);
    }
}
