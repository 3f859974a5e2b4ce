/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import it.corsinvest.hcloud.api.schema.Schema;

/**
 * Converts wire objects into domain objects. Every method returns null for a null input.
 */
public final class SchemaConverter {

    private SchemaConverter() {
    }

    static OffsetDateTime toTime(String value) {
        return value == null || value.isEmpty() ? null : OffsetDateTime.parse(value);
    }

    public static Pagination toPagination(Schema.MetaPagination s) {
        if (s == null) {
            return null;
        }
        return new Pagination(s.page,
                s.perPage,
                s.previousPage != null ? s.previousPage : 0,
                s.nextPage != null ? s.nextPage : 0,
                s.lastPage,
                s.totalEntries);
    }

    public static Action toAction(Schema.Action s) {
        if (s == null) {
            return null;
        }
        var resources = new ArrayList<ActionResource>();
        if (s.resources != null) {
            s.resources.forEach(r -> resources.add(new ActionResource(r.id, r.type)));
        }
        return new Action(s.id,
                s.command,
                ActionStatus.fromValue(s.status),
                s.progress,
                toTime(s.started),
                toTime(s.finished),
                s.error != null ? s.error.code : null,
                s.error != null ? s.error.message : null,
                resources);
    }

    public static SSHKey toSSHKey(Schema.SSHKey s) {
        if (s == null) {
            return null;
        }
        return new SSHKey(s.id, s.name, s.fingerprint, s.publicKey);
    }

    public static Location toLocation(Schema.Location s) {
        if (s == null) {
            return null;
        }
        return new Location(s.id, s.name, s.description, s.country, s.city, s.latitude, s.longitude);
    }

    public static Datacenter toDatacenter(Schema.Datacenter s) {
        if (s == null) {
            return null;
        }
        return new Datacenter(s.id, s.name, s.description, toLocation(s.location));
    }

    public static ServerType toServerType(Schema.ServerType s) {
        if (s == null) {
            return null;
        }
        return new ServerType(s.id, s.name, s.description, s.cores, s.memory, s.disk, s.storageType);
    }

    public static Image toImage(Schema.Image s) {
        if (s == null) {
            return null;
        }
        return new Image(s.id,
                s.name,
                ImageType.fromValue(s.type),
                ImageStatus.fromValue(s.status),
                s.description,
                s.imageSize,
                s.diskSize,
                toTime(s.created),
                s.createdFrom != null ? s.createdFrom.id : 0,
                s.createdFrom != null ? s.createdFrom.name : null,
                s.boundTo,
                s.osFlavor,
                s.osVersion,
                s.rapidDeploy);
    }

    public static ServerPublicNet toServerPublicNet(Schema.ServerPublicNet s) {
        if (s == null) {
            return null;
        }
        var ipv4 = s.ipv4 != null ? s.ipv4 : new Schema.ServerPublicNetIPv4();
        var ipv6 = s.ipv6 != null ? s.ipv6 : new Schema.ServerPublicNetIPv6();
        return new ServerPublicNet(ipv4.ip,
                ipv4.blocked,
                ipv4.dnsPtr,
                ipv6.ip,
                ipv6.blocked,
                s.floatingIPs);
    }

    public static Server toServer(Schema.Server s) {
        if (s == null) {
            return null;
        }
        return new Server(s.id,
                s.name,
                toTime(s.created),
                ServerStatus.fromValue(s.status),
                toServerPublicNet(s.publicNet),
                toServerType(s.serverType),
                toDatacenter(s.datacenter),
                toImage(s.image),
                s.includedTraffic,
                s.outgoingTraffic,
                s.ingoingTraffic,
                s.backupWindow,
                s.rescueEnabled,
                s.locked);
    }

    /**
     * Apply a converter to every element.
     *
     * @param <S> wire type
     * @param <T> domain type
     * @param items wire objects
     * @param converter conversion function
     * @return List domain objects in the same order
     */
    public static <S, T> List<T> toList(List<S> items, Function<S, T> converter) {
        var ret = new ArrayList<T>(items.size());
        items.forEach(item -> ret.add(converter.apply(item)));
        return ret;
    }
}
