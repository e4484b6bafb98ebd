package com.numaansystems.openam.profile;

import com.numaansystems.openam.exception.ProfileMappingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Maps raw OpenAM identity attributes onto an {@link OpenAmProfile}.
 *
 * <h2>Attribute Mapping</h2>
 * <ul>
 *   <li>{@code tokenid} &rarr; id</li>
 *   <li>{@code uid} &rarr; username</li>
 *   <li>{@code cn} &rarr; displayName</li>
 *   <li>{@code sn} &rarr; name.familyName</li>
 *   <li>{@code givenname} &rarr; name.givenName</li>
 *   <li>{@code mail} &rarr; email</li>
 * </ul>
 *
 * <p>The mapper is stateless; mapping the same attribute map twice yields
 * equal profiles.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class ProfileMapper {

    private static final Logger logger = LoggerFactory.getLogger(ProfileMapper.class);

    public static final String ATTR_TOKEN_ID = "tokenid";
    public static final String ATTR_UID = "uid";
    public static final String ATTR_COMMON_NAME = "cn";
    public static final String ATTR_SURNAME = "sn";
    public static final String ATTR_GIVEN_NAME = "givenname";
    public static final String ATTR_MAIL = "mail";

    /**
     * Normalizes the attribute map.
     *
     * @param attributes attributes as returned by OpenAM
     * @return the normalized profile
     * @throws ProfileMappingException if the map is missing or cannot be read
     */
    public OpenAmProfile toProfile(Map<String, String> attributes) {
        if (attributes == null) {
            throw new ProfileMappingException("OpenAM returned no attributes");
        }

        try {
            OpenAmProfile profile = new OpenAmProfile(
                    attributes.get(ATTR_TOKEN_ID),
                    attributes.get(ATTR_UID),
                    attributes.get(ATTR_COMMON_NAME),
                    new OpenAmProfile.Name(attributes.get(ATTR_SURNAME), attributes.get(ATTR_GIVEN_NAME)),
                    attributes.get(ATTR_MAIL),
                    attributes);
            logger.debug("Mapped {} OpenAM attributes for user {}", attributes.size(), profile.getUsername());
            return profile;
        } catch (RuntimeException e) {
            throw new ProfileMappingException("failed to map OpenAM attributes", e);
        }
    }
}
