package com.radarloop.exception;

/**
 * The archive has no files for a site, so there is nothing to animate. Reported
 * to the user together with a link to the site's status page.
 */
public class NoCandidateFilesException extends RadarLoopException {

    protected final String site;

    public NoCandidateFilesException(String site) {
        super("No suitable files found for " + site);
        this.site = site;
    }

    public String getSite() {
        return site;
    }

    /**
     * @return the NWS free-text status message page for the site (the site code without its
     * leading region letter)
     */
    public String getStatusUrl() {
        String office = (site != null && site.length() > 1) ? site.substring(1) : site;
        return "http://forecast.weather.gov/product.php?site=NWS&product=FTM&format=TXT&issuedby=" + office;
    }
}
