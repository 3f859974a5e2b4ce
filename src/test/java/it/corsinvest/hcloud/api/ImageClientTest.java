/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageClientTest {

    private TestEnv env;
    private ImageClient images;

    @BeforeEach
    void setUp() throws IOException {
        env = new TestEnv();
        images = env.client().getImage();
    }

    @AfterEach
    void tearDown() {
        env.close();
    }

    @Test
    void get_converts_snapshot() throws HCloudException {
        env.handle("/images/4711", """
                {
                  "image": {
                    "id": 4711,
                    "type": "snapshot",
                    "status": "available",
                    "name": null,
                    "description": "my snapshot",
                    "image_size": 2.3,
                    "disk_size": 10,
                    "created": "2016-01-30T23:55:01+00:00",
                    "created_from": {"id": 1, "name": "my-server"},
                    "bound_to": null,
                    "os_flavor": "ubuntu",
                    "os_version": "16.04",
                    "rapid_deploy": false
                  }
                }
                """);

        var image = images.get(4711);

        assertThat(image.getId()).isEqualTo(4711);
        assertThat(image.getType()).isEqualTo(ImageType.SNAPSHOT);
        assertThat(image.getStatus()).isEqualTo(ImageStatus.AVAILABLE);
        assertThat(image.getName()).isNull();
        assertThat(image.getDescription()).isEqualTo("my snapshot");
        assertThat(image.getImageSize()).isEqualTo(2.3);
        assertThat(image.getDiskSize()).isEqualTo(10.0);
        assertThat(image.getCreated().getMinute()).isEqualTo(55);
        assertThat(image.getCreatedFromId()).isEqualTo(1);
        assertThat(image.getCreatedFromName()).isEqualTo("my-server");
        assertThat(image.getBoundTo()).isNull();
        assertThat(image.getOsFlavor()).isEqualTo("ubuntu");
        assertThat(image.getOsVersion()).isEqualTo("16.04");
        assertThat(image.isRapidDeploy()).isFalse();
    }

    @Test
    void get_backup_keeps_bound_server() throws HCloudException {
        env.handle("/images/5", "{\"image\": {\"id\": 5, \"type\": \"backup\", \"bound_to\": 42}}");

        var image = images.get(5);

        assertThat(image.getType()).isEqualTo(ImageType.BACKUP);
        assertThat(image.getBoundTo()).isEqualTo(42L);
        assertThat(image.getCreated()).isNull();
    }

    @Test
    void get_not_found_returns_null() throws HCloudException {
        env.handle("/images/5", 404, "{\"error\": {\"code\": \"not_found\", \"message\": \"gone\"}}");

        assertThat(images.get(5)).isNull();
    }

    @Test
    void all_with_type_filter() throws HCloudException {
        env.handle("/images", """
                {
                  "images": [{"id": 1, "type": "system", "name": "ubuntu-22.04"}],
                  "meta": {"pagination": {"page": 1, "per_page": 50, "last_page": 1, "total_entries": 1}}
                }
                """);

        var opts = new ImageListOpts();
        opts.setType(ImageType.SYSTEM);
        var all = images.all(opts);

        assertThat(all).extracting(Image::getName).containsExactly("ubuntu-22.04");
        assertThat(env.requests().get(0).query())
                .containsEntry("type", "system")
                .containsEntry("per_page", "50");
    }

    @Test
    void update_sends_only_set_fields() throws HCloudException {
        env.handle("/images/5", "{\"image\": {\"id\": 5, \"type\": \"snapshot\", \"description\": \"kept\"}}");

        var opts = new ImageUpdateOpts();
        opts.setType(ImageType.SNAPSHOT);
        var image = images.update(5, opts);

        assertThat(image.getType()).isEqualTo(ImageType.SNAPSHOT);
        var request = env.requests().get(0);
        assertThat(request.method()).isEqualTo("PUT");
        assertThat(request.json().get("type").asText()).isEqualTo("snapshot");
        assertThat(request.json().has("description")).isFalse();
    }

    @Test
    void update_with_system_type_is_rejected_locally() {
        var opts = new ImageUpdateOpts();
        opts.setType(ImageType.SYSTEM);

        assertThatThrownBy(() -> images.update(5, opts))
                .isInstanceOf(HCloudExceptionValidation.class);
        assertThat(env.requests()).isEmpty();
    }

    @Test
    void delete_sends_delete() throws HCloudException {
        env.handle("/images/5", 204, null);

        images.delete(5);

        assertThat(env.requests().get(0).method()).isEqualTo("DELETE");
    }
}
