/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.List;
import it.corsinvest.hcloud.api.schema.Schema;

/**
 * Client for the actions API.
 */
public class ActionClient extends ResourceClientBase {

    protected ActionClient(HCloudClientBase client) {
        super(client);
    }

    /**
     * Read an action.
     *
     * @param id action id
     * @return Action or null when it does not exist
     * @throws HCloudException on transport or API error
     */
    public Action get(long id) throws HCloudException {
        return getById("/actions/" + id, "action", Schema.Action.class, SchemaConverter::toAction);
    }

    /**
     * List a single page of actions.
     *
     * @param opts paging and filter options, may be null
     * @return Page
     * @throws HCloudException on transport or API error
     */
    public Page<Action> list(ActionListOpts opts) throws HCloudException {
        return listPage("/actions", "actions", opts, Schema.Action.class, SchemaConverter::toAction);
    }

    /**
     * Read all actions.
     *
     * @return List
     * @throws HCloudException on transport or API error
     */
    public List<Action> all() throws HCloudException {
        return all(new ActionListOpts());
    }

    /**
     * Read all actions matching the filters of the options. Page and page size
     * of the options are overwritten.
     *
     * @param opts filter options, may be null
     * @return List
     * @throws HCloudException on transport or API error
     */
    public List<Action> all(ActionListOpts opts) throws HCloudException {
        var listOpts = opts != null ? opts : new ActionListOpts();
        listOpts.setPerPage(ALL_PER_PAGE);
        return _client.all(page -> {
            listOpts.setPage(page);
            return list(listOpts);
        });
    }
}
