package io.biblcal.visibility;

import io.biblcal.time.TimeOfDay;

/**
 * One evening's crescent search, frozen once the moonset search converged.
 *
 * @param julianDay the integral Julian Day of the evening
 * @param sunset sunset, zone time
 * @param moonset moonset, zone time
 * @param timeLagMinutes moonset minus sunset, whole minutes
 * @param illumination illuminated fraction of the disk, percent
 * @param sunAzimuth azimuth of the setting sun, degrees
 * @param moonAzimuth azimuth of the moon at sunset, degrees
 * @param moonAltitude altitude of the moon at sunset, degrees
 * @param sunAltitudeAtMoonset altitude of the sun at moonset with refraction allowance, degrees
 * @param visibilityIndex the visibility index
 * @param tier the tier the index falls in
 * @param iterations moonset search iterations used
 */
public record EveningObservation(
    double julianDay,
    TimeOfDay sunset,
    TimeOfDay moonset,
    int timeLagMinutes,
    double illumination,
    double sunAzimuth,
    double moonAzimuth,
    double moonAltitude,
    double sunAltitudeAtMoonset,
    double visibilityIndex,
    VisibilityTier tier,
    int iterations) {}
