package au.org.ala.imagegen.codec;

/**
 * Produces the short tag appended to encoded parameters. The tag disambiguates cached derivatives, it is not a
 * security boundary.
 */
public interface HashGenerator {

    int HASH_LENGTH = 6;

    /**
     * @return {@link #HASH_LENGTH} lower case letters or digits
     */
    String generateHash(String value);

}
