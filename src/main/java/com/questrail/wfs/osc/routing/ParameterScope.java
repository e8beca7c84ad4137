package com.questrail.wfs.osc.routing;

/**
 * Which family of application state a parameter belongs to, with the
 * standard OSC address prefix and the REMOTE dialect prefix for that family.
 */
public enum ParameterScope
{
    INPUT("/wfs/input/", "/remoteInput/"),
    OUTPUT("/wfs/output/", "/remoteInput/output/"),
    REVERB("/wfs/reverb/", "/remoteInput/reverb/"),
    CONFIG("/wfs/config/", null);

    private final String oscPrefix;
    private final String remotePrefix;

    ParameterScope(String oscPrefix, String remotePrefix)
    {
        this.oscPrefix = oscPrefix;
        this.remotePrefix = remotePrefix;
    }

    public String oscPrefix()
    {
        return oscPrefix;
    }

    /**
     * @return the REMOTE prefix, or {@code null} for scopes REMOTE clients never see
     */
    public String remotePrefix()
    {
        return remotePrefix;
    }

    /**
     * Channel scopes address one input, output or reverb by id.
     */
    public boolean isChannelScope()
    {
        return this != CONFIG;
    }
}
