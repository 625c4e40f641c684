package shortlink.codes;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Random fixed-length codes over {@code [0-9A-Za-z]}.
 */
public class RandomCodeGenerator implements CodeGenerator {
    public static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";

    public static final int DEFAULT_LENGTH = 7;
    public static final int MIN_LENGTH = 4;
    public static final int MAX_LENGTH = 32;

    private final Random random;
    private final int length;

    public RandomCodeGenerator(){
        this(DEFAULT_LENGTH);
    }

    public RandomCodeGenerator(int length){
        this(new SecureRandom(), length);
    }

    public RandomCodeGenerator(Random random, int length){
        if(length < MIN_LENGTH || length > MAX_LENGTH)
            throw new IllegalArgumentException("Code length must be between " + MIN_LENGTH + " and " + MAX_LENGTH + ", got " + length);
        this.random = random;
        this.length = length;
    }

    public int getLength() {
        return length;
    }

    @Override
    public String next() {
        StringBuilder sb = new StringBuilder(length);
        for(int i = 0; i < length; ++i){
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    /**
     * Whether {@code code} could have been produced by a generator of any
     * allowed length.
     */
    public static boolean isWellFormed(String code){
        if(code == null || code.isEmpty() || code.length() > MAX_LENGTH) return false;
        for(int i = 0; i < code.length(); ++i){
            if(ALPHABET.indexOf(code.charAt(i)) < 0) return false;
        }
        return true;
    }
}
