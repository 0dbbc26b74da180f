package au.org.ala.imagegen.codec;

import org.apache.commons.codec.digest.DigestUtils;

public class Md5HashGenerator implements HashGenerator {

    public static final Md5HashGenerator INSTANCE = new Md5HashGenerator();

    @Override
    public String generateHash(String value) {
        return DigestUtils.md5Hex(value).substring(0, HASH_LENGTH);
    }

}
