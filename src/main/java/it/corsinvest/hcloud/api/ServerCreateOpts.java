/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options for creating a server. Server type, image, location and datacenter
 * are referenced either by id or by name.
 */
public class ServerCreateOpts {

    private String _name;
    private Object _serverType;
    private Object _image;
    private final List<Long> _sshKeys = new ArrayList<>();
    private Object _location;
    private Object _datacenter;
    private String _userData;
    private Boolean _startAfterCreate;

    public String getName() {
        return _name;
    }

    public void setName(String name) {
        _name = name;
    }

    /**
     * Server type, as {@link Long} id or {@link String} name.
     *
     * @return Object
     */
    public Object getServerType() {
        return _serverType;
    }

    public void setServerType(long id) {
        _serverType = id;
    }

    public void setServerType(String name) {
        _serverType = name;
    }

    /**
     * Image, as {@link Long} id or {@link String} name.
     *
     * @return Object
     */
    public Object getImage() {
        return _image;
    }

    public void setImage(long id) {
        _image = id;
    }

    public void setImage(String name) {
        _image = name;
    }

    public List<Long> getSSHKeys() {
        return _sshKeys;
    }

    /**
     * Add an SSH key injected into the server.
     *
     * @param id SSH key id
     */
    public void addSSHKey(long id) {
        _sshKeys.add(id);
    }

    public Object getLocation() {
        return _location;
    }

    public void setLocation(long id) {
        _location = id;
    }

    public void setLocation(String name) {
        _location = name;
    }

    public Object getDatacenter() {
        return _datacenter;
    }

    public void setDatacenter(long id) {
        _datacenter = id;
    }

    public void setDatacenter(String name) {
        _datacenter = name;
    }

    public String getUserData() {
        return _userData;
    }

    /**
     * Set cloud-init user data.
     *
     * @param userData user data
     */
    public void setUserData(String userData) {
        _userData = userData;
    }

    public Boolean getStartAfterCreate() {
        return _startAfterCreate;
    }

    /**
     * Whether to start the server once created, API default is true.
     *
     * @param startAfterCreate start after create
     */
    public void setStartAfterCreate(Boolean startAfterCreate) {
        _startAfterCreate = startAfterCreate;
    }

    /**
     * Checks if options are valid.
     *
     * @throws HCloudExceptionValidation when a required value is missing
     */
    public void validate() throws HCloudExceptionValidation {
        if (_name == null || _name.isEmpty()) {
            throw new HCloudExceptionValidation("missing name");
        }
        if (isEmpty(_serverType)) {
            throw new HCloudExceptionValidation("missing server type");
        }
        if (isEmpty(_image)) {
            throw new HCloudExceptionValidation("missing image");
        }
        if (_location != null && _datacenter != null) {
            throw new HCloudExceptionValidation("location and datacenter are mutually exclusive");
        }
    }

    private static boolean isEmpty(Object reference) {
        return reference == null
                || (reference instanceof String name && name.isEmpty())
                || (reference instanceof Long id && id <= 0);
    }

    Map<String, Object> toParameters() {
        var params = new LinkedHashMap<String, Object>();
        params.put("name", _name);
        params.put("server_type", _serverType);
        params.put("image", _image);
        params.put("ssh_keys", _sshKeys.isEmpty() ? null : _sshKeys);
        params.put("location", _location);
        params.put("datacenter", _datacenter);
        params.put("user_data", _userData);
        params.put("start_after_create", _startAfterCreate);
        return params;
    }
}
