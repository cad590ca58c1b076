package com.questrail.shepherd.daemon;

/**
 * The one line a shepherd prints on stdout once it is listening.
 *
 * @param pid       shepherd process id
 * @param startTime shepherd start time in epoch milliseconds
 */
public record ShepherdInfo(long pid, long startTime)
{
}
