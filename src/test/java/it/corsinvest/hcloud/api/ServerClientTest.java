/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.io.IOException;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerClientTest {

    private static final String SERVER = """
            {
              "id": 42,
              "name": "my-server",
              "created": "2016-01-30T23:50:00+00:00",
              "status": "running",
              "public_net": {
                "ipv4": {"ip": "1.2.3.4", "blocked": false, "dns_ptr": "server01.example.com"},
                "ipv6": {"ip": "2001:db8::/64", "blocked": true},
                "floating_ips": [478]
              },
              "server_type": {
                "id": 1, "name": "cx11", "description": "CX11", "cores": 1,
                "memory": 1, "disk": 25, "storage_type": "local"
              },
              "datacenter": {
                "id": 1, "name": "fsn1-dc8", "description": "Falkenstein 1 DC 8",
                "location": {
                  "id": 1, "name": "fsn1", "description": "Falkenstein DC Park 1",
                  "country": "DE", "city": "Falkenstein", "latitude": 50.47612, "longitude": 12.370071
                }
              },
              "image": {"id": 4711, "name": "ubuntu-16.04", "type": "system", "status": "available"},
              "included_traffic": 654321,
              "outgoing_traffic": 123456,
              "ingoing_traffic": null,
              "backup_window": "22-02",
              "rescue_enabled": false,
              "locked": false
            }
            """;

    private TestEnv env;
    private ServerClient servers;

    @BeforeEach
    void setUp() throws IOException {
        env = new TestEnv();
        servers = env.client().getServer();
    }

    @AfterEach
    void tearDown() {
        env.close();
    }

    @Test
    void get_converts_server() throws HCloudException {
        env.handle("/servers/42", "{\"server\": " + SERVER + "}");

        var server = servers.get(42);

        assertThat(server).isNotNull();
        assertThat(server.getId()).isEqualTo(42);
        assertThat(server.getName()).isEqualTo("my-server");
        assertThat(server.getStatus()).isEqualTo(ServerStatus.RUNNING);
        assertThat(server.getCreated().getYear()).isEqualTo(2016);
        assertThat(server.getPublicNet().getIPv4()).isEqualTo("1.2.3.4");
        assertThat(server.getPublicNet().getIPv4DnsPtr()).isEqualTo("server01.example.com");
        assertThat(server.getPublicNet().isIPv6Blocked()).isTrue();
        assertThat(server.getPublicNet().getFloatingIPs()).containsExactly(478L);
        assertThat(server.getServerType().getName()).isEqualTo("cx11");
        assertThat(server.getServerType().getDisk()).isEqualTo(25);
        assertThat(server.getDatacenter().getLocation().getCountry()).isEqualTo("DE");
        assertThat(server.getImage().getType()).isEqualTo(ImageType.SYSTEM);
        assertThat(server.getIncludedTraffic()).isEqualTo(654321L);
        assertThat(server.getIngoingTraffic()).isNull();
        assertThat(server.getBackupWindow()).isEqualTo("22-02");
    }

    @Test
    void get_not_found_returns_null() throws HCloudException {
        env.handle("/servers/1", 404, """
                {"error": {"code": "not_found", "message": "server with ID '1' not found"}}
                """);

        assertThat(servers.get(1)).isNull();
    }

    @Test
    void get_other_api_error_is_raised() {
        env.handle("/servers/1", 403, "{\"error\": {\"code\": \"forbidden\", \"message\": \"no\"}}");

        assertThatThrownBy(() -> servers.get(1))
                .isInstanceOf(HCloudExceptionApi.class)
                .hasMessageContaining("forbidden");
    }

    @Test
    void get_by_name_filters_on_name() throws HCloudException {
        env.handle("/servers", "{\"servers\": [" + SERVER + "]}");

        var server = servers.getByName("my-server");

        assertThat(server.getId()).isEqualTo(42);
        assertThat(env.requests().get(0).query()).containsEntry("name", "my-server");
    }

    @Test
    void get_by_name_returns_null_when_no_match() throws HCloudException {
        env.handle("/servers", "{\"servers\": []}");

        assertThat(servers.getByName("missing")).isNull();
    }

    @ParameterizedTest
    @NullAndEmptySource
    void get_by_name_without_name_sends_no_request(String name) throws HCloudException {
        env.handle("/servers", "{\"servers\": [{\"id\": 7, \"name\": \"prod-db\"}]}");

        assertThat(servers.getByName(name)).isNull();
        assertThat(env.requests()).isEmpty();
    }

    @Test
    void get_with_malformed_time_raises_transport_exception() {
        env.handle("/servers/1", "{\"server\": {\"id\": 1, \"created\": \"yesterday\"}}");

        assertThatThrownBy(() -> servers.get(1))
                .isInstanceOf(HCloudExceptionTransport.class)
                .hasMessageContaining("server")
                .hasCauseInstanceOf(DateTimeParseException.class);
    }

    @Test
    void list_with_malformed_time_raises_transport_exception() {
        env.handle("/servers", "{\"servers\": [{\"id\": 1, \"created\": \"yesterday\"}]}");

        assertThatThrownBy(() -> servers.list(null))
                .isInstanceOf(HCloudExceptionTransport.class);
    }

    @Test
    void list_encodes_page_and_per_page() throws HCloudException {
        env.handle("/servers", "{\"servers\": [{\"id\": 1}, {\"id\": 2}]}");

        var opts = new ServerListOpts();
        opts.setPage(2);
        opts.setPerPage(50);
        opts.setStatus(ServerStatus.OFF);
        var page = servers.list(opts);

        assertThat(page.getItems()).extracting(Server::getId).containsExactly(1L, 2L);
        assertThat(env.requests().get(0).query())
                .containsEntry("page", "2")
                .containsEntry("per_page", "50")
                .containsEntry("status", "off")
                .doesNotContainKey("name");
    }

    @Test
    void all_aggregates_every_page() throws HCloudException {
        env.handle("/servers", request -> {
            var page = Integer.parseInt(request.query().get("page"));
            var items = new ArrayList<Map<String, Object>>();
            for (var i = 1; i <= 50; i++) {
                items.add(Map.of("id", (page - 1) * 50 + i));
            }
            return new TestEnv.Reply(200, TestEnv.json(Map.of(
                    "servers", items,
                    "meta", Map.of("pagination", Map.of(
                            "page", page,
                            "per_page", 50,
                            "last_page", 3,
                            "total_entries", 150)))));
        });

        var all = servers.all();

        assertThat(all).hasSize(150);
        assertThat(new HashSet<>(all.stream().map(Server::getId).toList())).hasSize(150);
        assertThat(all.get(0).getId()).isEqualTo(1);
        assertThat(all.get(149).getId()).isEqualTo(150);
        assertThat(env.requests()).extracting(r -> r.query().get("page")).containsExactly("1", "2", "3");
        assertThat(env.requests()).allSatisfy(r -> assertThat(r.query()).containsEntry("per_page", "50"));
    }

    @Test
    void all_single_page_without_meta() throws HCloudException {
        env.handle("/servers", "{\"servers\": [{\"id\": 1}, {\"id\": 2}, {\"id\": 3}]}");

        assertThat(servers.all()).extracting(Server::getId).containsExactly(1L, 2L, 3L);
        assertThat(env.requests()).hasSize(1);
    }

    @Test
    void all_accepts_null_options() throws HCloudException {
        env.handle("/servers", "{\"servers\": [{\"id\": 1}]}");

        assertThat(servers.all(null)).extracting(Server::getId).containsExactly(1L);
        assertThat(env.requests().get(0).query())
                .containsEntry("page", "1")
                .containsEntry("per_page", "50");
    }

    @Test
    void all_fails_when_a_page_fails() {
        env.handle("/servers", request -> "1".equals(request.query().get("page"))
                ? new TestEnv.Reply(200, """
                        {"servers": [{"id": 1}], "meta": {"pagination": {"page": 1, "per_page": 1, "last_page": 2}}}
                        """)
                : new TestEnv.Reply(503, "{\"error\": {\"code\": \"service_error\", \"message\": \"down\"}}"));

        assertThatThrownBy(() -> servers.all())
                .isInstanceOf(HCloudExceptionApi.class)
                .hasMessageContaining("service_error");
    }

    @Test
    void create_sends_options_and_returns_result() throws HCloudException {
        env.handle("/servers", 201, """
                {
                  "server": {"id": 1, "name": "test"},
                  "action": {"id": 10, "command": "create_server", "status": "running", "progress": 0},
                  "root_password": "secret"
                }
                """);

        var opts = new ServerCreateOpts();
        opts.setName("test");
        opts.setServerType("cx11");
        opts.setImage(2);
        opts.addSSHKey(7);
        opts.setLocation("fsn1");
        opts.setStartAfterCreate(false);
        var result = servers.create(opts);

        assertThat(result.getServer().getId()).isEqualTo(1);
        assertThat(result.getAction().getId()).isEqualTo(10);
        assertThat(result.getAction().getStatus()).isEqualTo(ActionStatus.RUNNING);
        assertThat(result.getRootPassword()).isEqualTo("secret");

        var body = env.requests().get(0).json();
        assertThat(body.get("name").asText()).isEqualTo("test");
        assertThat(body.get("server_type").asText()).isEqualTo("cx11");
        assertThat(body.get("image").asLong()).isEqualTo(2);
        assertThat(body.get("ssh_keys").get(0).asLong()).isEqualTo(7);
        assertThat(body.get("location").asText()).isEqualTo("fsn1");
        assertThat(body.get("start_after_create").asBoolean()).isFalse();
        assertThat(body.has("datacenter")).isFalse();
        assertThat(body.has("user_data")).isFalse();
    }

    @Test
    void create_without_name_does_not_send_request() {
        var opts = new ServerCreateOpts();
        opts.setServerType(1);
        opts.setImage(2);

        assertThatThrownBy(() -> servers.create(opts))
                .isInstanceOf(HCloudExceptionValidation.class)
                .hasMessage("missing name");
        assertThat(env.requests()).isEmpty();
    }

    @Test
    void create_without_server_type_does_not_send_request() {
        var opts = new ServerCreateOpts();
        opts.setName("test");
        opts.setImage("ubuntu-16.04");

        assertThatThrownBy(() -> servers.create(opts))
                .isInstanceOf(HCloudExceptionValidation.class)
                .hasMessage("missing server type");
        assertThat(env.requests()).isEmpty();
    }

    @Test
    void create_without_image_does_not_send_request() {
        var opts = new ServerCreateOpts();
        opts.setName("test");
        opts.setServerType("cx11");

        assertThatThrownBy(() -> servers.create(opts))
                .isInstanceOf(HCloudExceptionValidation.class)
                .hasMessage("missing image");
        assertThat(env.requests()).isEmpty();
    }

    @Test
    void create_with_location_and_datacenter_is_rejected() {
        var opts = new ServerCreateOpts();
        opts.setName("test");
        opts.setServerType("cx11");
        opts.setImage("ubuntu-16.04");
        opts.setLocation("fsn1");
        opts.setDatacenter("fsn1-dc8");

        assertThatThrownBy(() -> servers.create(opts))
                .isInstanceOf(HCloudExceptionValidation.class);
        assertThat(env.requests()).isEmpty();
    }

    @Test
    void update_renames_server() throws HCloudException {
        env.handle("/servers/1", "{\"server\": {\"id\": 1, \"name\": \"renamed\"}}");

        var server = servers.update(1, "renamed");

        assertThat(server.getName()).isEqualTo("renamed");
        assertThat(env.requests().get(0).method()).isEqualTo("PUT");
        assertThat(env.requests().get(0).json().get("name").asText()).isEqualTo("renamed");
    }

    @Test
    void delete_sends_delete() throws HCloudException {
        env.handle("/servers/1", 204, null);

        var response = servers.delete(1);

        assertThat(response.getStatusCode()).isEqualTo(204);
        assertThat(env.requests().get(0).method()).isEqualTo("DELETE");
    }

    @ParameterizedTest
    @ValueSource(strings = { "poweron", "poweroff", "reboot", "reset", "shutdown", "disable_rescue" })
    void lifecycle_action_posts_to_sub_path(String name) throws HCloudException {
        env.handle("/servers/1/actions/" + name,
                201, "{\"action\": {\"id\": 13, \"command\": \"" + name + "\", \"status\": \"running\"}}");

        var action = switch (name) {
            case "poweron" -> servers.poweron(1);
            case "poweroff" -> servers.poweroff(1);
            case "reboot" -> servers.reboot(1);
            case "reset" -> servers.reset(1);
            case "shutdown" -> servers.shutdown(1);
            case "disable_rescue" -> servers.disableRescue(1);
            default -> throw new AssertionError(name);
        };

        assertThat(action.getId()).isEqualTo(13);
        assertThat(env.requests()).hasSize(1);
        assertThat(env.requests().get(0).method()).isEqualTo("POST");
        assertThat(env.requests().get(0).path()).isEqualTo("/servers/1/actions/" + name);
    }

    @Test
    void reset_password_returns_root_password() throws HCloudException {
        env.handle("/servers/1/actions/reset_password", 201, """
                {"action": {"id": 1, "command": "reset_password", "status": "running"}, "root_password": "secret"}
                """);

        var result = servers.resetPassword(1);

        assertThat(result.getAction().getId()).isEqualTo(1);
        assertThat(result.getRootPassword()).isEqualTo("secret");
    }

    @Test
    void create_image_without_options() throws HCloudException {
        env.handle("/servers/1/actions/create_image", 201, """
                {"action": {"id": 1}, "image": {"id": 1, "type": "snapshot", "status": "creating"}}
                """);

        var result = servers.createImage(1, null);

        assertThat(result.getAction().getId()).isEqualTo(1);
        assertThat(result.getImage().getId()).isEqualTo(1);
        assertThat(result.getImage().getStatus()).isEqualTo(ImageStatus.CREATING);
        assertThat(env.requests().get(0).json().size()).isZero();
    }

    @Test
    void create_image_with_options() throws HCloudException {
        env.handle("/servers/1/actions/create_image", 201, """
                {"action": {"id": 1}, "image": {"id": 1}}
                """);

        var opts = new ServerCreateImageOpts();
        opts.setType(ImageType.BACKUP);
        opts.setDescription("my backup");
        var result = servers.createImage(1, opts);

        assertThat(result.getImage().getId()).isEqualTo(1);
        var body = env.requests().get(0).json();
        assertThat(body.get("type").asText()).isEqualTo("backup");
        assertThat(body.get("description").asText()).isEqualTo("my backup");
    }

    @Test
    void create_image_with_system_type_is_rejected() {
        var opts = new ServerCreateImageOpts();
        opts.setType(ImageType.SYSTEM);

        assertThatThrownBy(() -> servers.createImage(1, opts))
                .isInstanceOf(HCloudExceptionValidation.class);
        assertThat(env.requests()).isEmpty();
    }

    @Nested
    class Rescue {

        @Test
        void enable_rescue_sends_options() throws HCloudException {
            env.handle("/servers/1/actions/enable_rescue", 201, """
                    {"action": {"id": 5, "command": "enable_rescue"}, "root_password": "rescue"}
                    """);

            var opts = new ServerEnableRescueOpts();
            opts.setType("linux64");
            opts.addSSHKey(3);
            var result = servers.enableRescue(1, opts);

            assertThat(result.getAction().getId()).isEqualTo(5);
            assertThat(result.getRootPassword()).isEqualTo("rescue");
            var body = env.requests().get(0).json();
            assertThat(body.get("type").asText()).isEqualTo("linux64");
            assertThat(body.get("ssh_keys").size()).isEqualTo(1);
        }

        @Test
        void enable_rescue_without_options() throws HCloudException {
            env.handle("/servers/1/actions/enable_rescue", 201, "{\"action\": {\"id\": 5}}");

            var result = servers.enableRescue(1, null);

            assertThat(result.getAction().getId()).isEqualTo(5);
            assertThat(result.getRootPassword()).isNull();
        }
    }

    @Test
    void server_ids_are_long() throws HCloudException {
        env.handle("/servers", "{\"servers\": [{\"id\": 4294967296}]}");

        List<Server> list = servers.list(null).getItems();

        assertThat(list.get(0).getId()).isEqualTo(4294967296L);
    }
}
