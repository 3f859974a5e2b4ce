/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

/**
 * Hetzner Cloud Client
 */
public class HCloudClient extends HCloudClientBase {

    /**
     * Environment variable holding the API token.
     */
    public static final String ENV_TOKEN = "HCLOUD_TOKEN";

    /**
     * Environment variable overriding the API endpoint.
     */
    public static final String ENV_ENDPOINT = "HCLOUD_ENDPOINT";

    private ActionClient _action;
    private ServerClient _server;
    private ServerTypeClient _serverType;
    private ImageClient _image;
    private SSHKeyClient _sshKey;
    private LocationClient _location;
    private DatacenterClient _datacenter;

    public HCloudClient(String token) {
        super(token);
    }

    public HCloudClient(String token, String endpoint) {
        super(token, endpoint);
    }

    /**
     * Create a client configured from {@value #ENV_TOKEN} and, when set, {@value #ENV_ENDPOINT}.
     *
     * @return HCloudClient
     * @throws IllegalStateException when the token variable is not set
     */
    public static HCloudClient fromEnvironment() {
        var token = System.getenv(ENV_TOKEN);
        if (token == null || token.isEmpty()) {
            throw new IllegalStateException(ENV_TOKEN + " environment variable not set");
        }
        var endpoint = System.getenv(ENV_ENDPOINT);
        return endpoint == null || endpoint.isEmpty()
                ? new HCloudClient(token)
                : new HCloudClient(token, endpoint);
    }

    public ActionClient getAction() {
        if (_action == null) {
            _action = new ActionClient(this);
        }
        return _action;
    }

    public ServerClient getServer() {
        if (_server == null) {
            _server = new ServerClient(this);
        }
        return _server;
    }

    public ServerTypeClient getServerType() {
        if (_serverType == null) {
            _serverType = new ServerTypeClient(this);
        }
        return _serverType;
    }

    public ImageClient getImage() {
        if (_image == null) {
            _image = new ImageClient(this);
        }
        return _image;
    }

    public SSHKeyClient getSSHKey() {
        if (_sshKey == null) {
            _sshKey = new SSHKeyClient(this);
        }
        return _sshKey;
    }

    public LocationClient getLocation() {
        if (_location == null) {
            _location = new LocationClient(this);
        }
        return _location;
    }

    public DatacenterClient getDatacenter() {
        if (_datacenter == null) {
            _datacenter = new DatacenterClient(this);
        }
        return _datacenter;
    }
}
