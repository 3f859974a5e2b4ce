/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.List;
import it.corsinvest.hcloud.api.schema.Schema;

/**
 * Client for the images API.
 */
public class ImageClient extends ResourceClientBase {

    protected ImageClient(HCloudClientBase client) {
        super(client);
    }

    /**
     * Read an image.
     *
     * @param id image id
     * @return Image or null when it does not exist
     * @throws HCloudException on transport or API error
     */
    public Image get(long id) throws HCloudException {
        return getById("/images/" + id, "image", Schema.Image.class, SchemaConverter::toImage);
    }

    /**
     * Read a system image by name, for example {@code ubuntu-16.04}.
     *
     * @param name image name
     * @return Image or null when no image has this name
     * @throws HCloudException on transport or API error
     */
    public Image getByName(String name) throws HCloudException {
        if (name == null || name.isEmpty()) {
            return null;
        }
        var opts = new ImageListOpts();
        opts.setName(name);
        return first(list(opts));
    }

    /**
     * List a single page of images.
     *
     * @param opts paging and filter options, may be null
     * @return Page
     * @throws HCloudException on transport or API error
     */
    public Page<Image> list(ImageListOpts opts) throws HCloudException {
        return listPage("/images", "images", opts, Schema.Image.class, SchemaConverter::toImage);
    }

    /**
     * Read all images.
     *
     * @return List
     * @throws HCloudException on transport or API error
     */
    public List<Image> all() throws HCloudException {
        return all(new ImageListOpts());
    }

    /**
     * Read all images matching the filters of the options. Page and page size
     * of the options are overwritten.
     *
     * @param opts filter options, may be null
     * @return List
     * @throws HCloudException on transport or API error
     */
    public List<Image> all(ImageListOpts opts) throws HCloudException {
        var listOpts = opts != null ? opts : new ImageListOpts();
        listOpts.setPerPage(ALL_PER_PAGE);
        return _client.all(page -> {
            listOpts.setPage(page);
            return list(listOpts);
        });
    }

    /**
     * Update an image.
     *
     * @param id image id
     * @param opts new values
     * @return Image updated image
     * @throws HCloudException on invalid options, transport or API error
     */
    public Image update(long id, ImageUpdateOpts opts) throws HCloudException {
        opts.validate();
        var response = _client.set("/images/" + id, opts.toParameters());
        return readObject(response, "image", Schema.Image.class, SchemaConverter::toImage);
    }

    /**
     * Delete a snapshot or backup.
     *
     * @param id image id
     * @return Response
     * @throws HCloudException on transport or API error
     */
    public Response delete(long id) throws HCloudException {
        return _client.delete("/images/" + id, null);
    }
}
