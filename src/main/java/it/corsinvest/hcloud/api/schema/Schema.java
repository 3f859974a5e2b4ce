/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api.schema;

import java.util.List;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire representation of the Hetzner Cloud API objects.
 * Field names follow the JSON documents; timestamps are kept as ISO-8601 text.
 */
public final class Schema {

    private Schema() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Meta {
        @JsonProperty("pagination")
        public MetaPagination pagination;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MetaPagination {
        @JsonProperty("page")
        public int page;
        @JsonProperty("per_page")
        public int perPage;
        @JsonProperty("previous_page")
        public Integer previousPage;
        @JsonProperty("next_page")
        public Integer nextPage;
        @JsonProperty("last_page")
        public int lastPage;
        @JsonProperty("total_entries")
        public int totalEntries;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Action {
        @JsonProperty("id")
        public long id;
        @JsonProperty("command")
        public String command;
        @JsonProperty("status")
        public String status;
        @JsonProperty("progress")
        public int progress;
        @JsonProperty("started")
        public String started;
        @JsonProperty("finished")
        public String finished;
        @JsonProperty("error")
        public ActionError error;
        @JsonProperty("resources")
        public List<ActionResourceReference> resources;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ActionError {
        @JsonProperty("code")
        public String code;
        @JsonProperty("message")
        public String message;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ActionResourceReference {
        @JsonProperty("id")
        public long id;
        @JsonProperty("type")
        public String type;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Server {
        @JsonProperty("id")
        public long id;
        @JsonProperty("name")
        public String name;
        @JsonProperty("created")
        public String created;
        @JsonProperty("status")
        public String status;
        @JsonProperty("public_net")
        public ServerPublicNet publicNet;
        @JsonProperty("server_type")
        public ServerType serverType;
        @JsonProperty("datacenter")
        public Datacenter datacenter;
        @JsonProperty("image")
        public Image image;
        @JsonProperty("included_traffic")
        public Long includedTraffic;
        @JsonProperty("outgoing_traffic")
        public Long outgoingTraffic;
        @JsonProperty("ingoing_traffic")
        public Long ingoingTraffic;
        @JsonProperty("backup_window")
        public String backupWindow;
        @JsonProperty("rescue_enabled")
        public boolean rescueEnabled;
        @JsonProperty("locked")
        public boolean locked;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ServerPublicNet {
        @JsonProperty("ipv4")
        public ServerPublicNetIPv4 ipv4;
        @JsonProperty("ipv6")
        public ServerPublicNetIPv6 ipv6;
        @JsonProperty("floating_ips")
        public List<Long> floatingIPs;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ServerPublicNetIPv4 {
        @JsonProperty("ip")
        public String ip;
        @JsonProperty("blocked")
        public boolean blocked;
        @JsonProperty("dns_ptr")
        public String dnsPtr;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ServerPublicNetIPv6 {
        @JsonProperty("ip")
        public String ip;
        @JsonProperty("blocked")
        public boolean blocked;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ServerType {
        @JsonProperty("id")
        public long id;
        @JsonProperty("name")
        public String name;
        @JsonProperty("description")
        public String description;
        @JsonProperty("cores")
        public int cores;
        @JsonProperty("memory")
        public double memory;
        @JsonProperty("disk")
        public int disk;
        @JsonProperty("storage_type")
        public String storageType;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Image {
        @JsonProperty("id")
        public long id;
        @JsonProperty("name")
        public String name;
        @JsonProperty("type")
        public String type;
        @JsonProperty("status")
        public String status;
        @JsonProperty("description")
        public String description;
        @JsonProperty("image_size")
        public Double imageSize;
        @JsonProperty("disk_size")
        public double diskSize;
        @JsonProperty("created")
        public String created;
        @JsonProperty("created_from")
        public ImageCreatedFrom createdFrom;
        @JsonProperty("bound_to")
        public Long boundTo;
        @JsonProperty("os_flavor")
        public String osFlavor;
        @JsonProperty("os_version")
        public String osVersion;
        @JsonProperty("rapid_deploy")
        public boolean rapidDeploy;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ImageCreatedFrom {
        @JsonProperty("id")
        public long id;
        @JsonProperty("name")
        public String name;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SSHKey {
        @JsonProperty("id")
        public long id;
        @JsonProperty("name")
        public String name;
        @JsonProperty("fingerprint")
        public String fingerprint;
        @JsonProperty("public_key")
        public String publicKey;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Location {
        @JsonProperty("id")
        public long id;
        @JsonProperty("name")
        public String name;
        @JsonProperty("description")
        public String description;
        @JsonProperty("country")
        public String country;
        @JsonProperty("city")
        public String city;
        @JsonProperty("latitude")
        public double latitude;
        @JsonProperty("longitude")
        public double longitude;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Datacenter {
        @JsonProperty("id")
        public long id;
        @JsonProperty("name")
        public String name;
        @JsonProperty("description")
        public String description;
        @JsonProperty("location")
        public Location location;
    }
}
