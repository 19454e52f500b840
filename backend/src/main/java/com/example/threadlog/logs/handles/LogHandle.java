package com.example.threadlog.logs.handles;

import com.example.threadlog.logs.models.Entry;

/**
 * Records entries under one fixed thread id.
 */
public interface LogHandle {

    String getId();

    Entry info(String message);

    Entry error(String message);

    Entry debug(String message);

    Entry infoF(String format, Object... args);

    Entry errorF(String format, Object... args);

    Entry debugF(String format, Object... args);
}
