package com.questrail.shepherd.session;

/**
 * Identity of a shepherd that reported itself ready.
 *
 * @param pid       shepherd process id
 * @param startTime shepherd start time in epoch milliseconds
 */
public record LaunchedShepherd(long pid, long startTime) {
}
