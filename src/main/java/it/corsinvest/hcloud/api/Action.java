/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Asynchronous operation started by the API, for example a server power on.
 * The record is a snapshot taken when it was read; poll with
 * {@link ActionClient#get(long)} to follow its progress.
 */
public class Action {

    private final long _id;
    private final String _command;
    private final ActionStatus _status;
    private final int _progress;
    private final OffsetDateTime _started;
    private final OffsetDateTime _finished;
    private final String _errorCode;
    private final String _errorMessage;
    private final List<ActionResource> _resources;

    public Action(long id,
            String command,
            ActionStatus status,
            int progress,
            OffsetDateTime started,
            OffsetDateTime finished,
            String errorCode,
            String errorMessage,
            List<ActionResource> resources) {
        _id = id;
        _command = command;
        _status = status;
        _progress = progress;
        _started = started;
        _finished = finished;
        _errorCode = errorCode;
        _errorMessage = errorMessage;
        _resources = resources != null ? List.copyOf(resources) : List.of();
    }

    public long getId() {
        return _id;
    }

    /**
     * Command executed, for example {@code start_server}.
     *
     * @return String
     */
    public String getCommand() {
        return _command;
    }

    public ActionStatus getStatus() {
        return _status;
    }

    /**
     * Progress in percent.
     *
     * @return int
     */
    public int getProgress() {
        return _progress;
    }

    public OffsetDateTime getStarted() {
        return _started;
    }

    /**
     * Finish time, null while running.
     *
     * @return OffsetDateTime
     */
    public OffsetDateTime getFinished() {
        return _finished;
    }

    /**
     * Error code when the action failed, otherwise null.
     *
     * @return String
     */
    public String getErrorCode() {
        return _errorCode;
    }

    public String getErrorMessage() {
        return _errorMessage;
    }

    public List<ActionResource> getResources() {
        return _resources;
    }
}
