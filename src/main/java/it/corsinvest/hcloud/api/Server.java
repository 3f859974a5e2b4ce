/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.time.OffsetDateTime;

/**
 * Cloud server.
 */
public class Server {

    private final long _id;
    private final String _name;
    private final OffsetDateTime _created;
    private final ServerStatus _status;
    private final ServerPublicNet _publicNet;
    private final ServerType _serverType;
    private final Datacenter _datacenter;
    private final Image _image;
    private final Long _includedTraffic;
    private final Long _outgoingTraffic;
    private final Long _ingoingTraffic;
    private final String _backupWindow;
    private final boolean _rescueEnabled;
    private final boolean _locked;

    public Server(long id,
            String name,
            OffsetDateTime created,
            ServerStatus status,
            ServerPublicNet publicNet,
            ServerType serverType,
            Datacenter datacenter,
            Image image,
            Long includedTraffic,
            Long outgoingTraffic,
            Long ingoingTraffic,
            String backupWindow,
            boolean rescueEnabled,
            boolean locked) {
        _id = id;
        _name = name;
        _created = created;
        _status = status;
        _publicNet = publicNet;
        _serverType = serverType;
        _datacenter = datacenter;
        _image = image;
        _includedTraffic = includedTraffic;
        _outgoingTraffic = outgoingTraffic;
        _ingoingTraffic = ingoingTraffic;
        _backupWindow = backupWindow;
        _rescueEnabled = rescueEnabled;
        _locked = locked;
    }

    public long getId() {
        return _id;
    }

    public String getName() {
        return _name;
    }

    public OffsetDateTime getCreated() {
        return _created;
    }

    public ServerStatus getStatus() {
        return _status;
    }

    public ServerPublicNet getPublicNet() {
        return _publicNet;
    }

    public ServerType getServerType() {
        return _serverType;
    }

    public Datacenter getDatacenter() {
        return _datacenter;
    }

    /**
     * Image the server was created from, null when it has been deleted.
     *
     * @return Image
     */
    public Image getImage() {
        return _image;
    }

    /**
     * Free traffic per billing period in bytes.
     *
     * @return Long
     */
    public Long getIncludedTraffic() {
        return _includedTraffic;
    }

    /**
     * Outbound traffic of the current billing period in bytes, null when unknown.
     *
     * @return Long
     */
    public Long getOutgoingTraffic() {
        return _outgoingTraffic;
    }

    /**
     * Inbound traffic of the current billing period in bytes, null when unknown.
     *
     * @return Long
     */
    public Long getIngoingTraffic() {
        return _ingoingTraffic;
    }

    /**
     * Time window of the daily backup, null when backups are disabled.
     *
     * @return String
     */
    public String getBackupWindow() {
        return _backupWindow;
    }

    public boolean isRescueEnabled() {
        return _rescueEnabled;
    }

    /**
     * Whether an action currently locks the server.
     *
     * @return boolean
     */
    public boolean isLocked() {
        return _locked;
    }
}
