package com.slicereport.core.fs;

import java.util.Comparator;

/**
 * Orders names the way people read them: {@code vert_slice_2} before {@code vert_slice_10}.
 * Digit runs compare by numeric value, everything else case-insensitively.
 */
public final class NaturalOrderComparator implements Comparator<String> {

    public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

    @Override
    public int compare(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (Character.isDigit(ca) && Character.isDigit(cb)) {
                int endA = digitRunEnd(a, i);
                int endB = digitRunEnd(b, j);
                int cmp = compareDigits(a.substring(i, endA), b.substring(j, endB));
                if (cmp != 0) {
                    return cmp;
                }
                i = endA;
                j = endB;
            } else {
                int cmp = Character.compare(Character.toLowerCase(ca), Character.toLowerCase(cb));
                if (cmp != 0) {
                    return cmp;
                }
                i++;
                j++;
            }
        }
        int remaining = Integer.compare(a.length() - i, b.length() - j);
        return remaining != 0 ? remaining : a.compareTo(b);
    }

    private static int digitRunEnd(String s, int start) {
        int end = start;
        while (end < s.length() && Character.isDigit(s.charAt(end))) {
            end++;
        }
        return end;
    }

    private static int compareDigits(String x, String y) {
        String strippedX = stripLeadingZeros(x);
        String strippedY = stripLeadingZeros(y);
        if (strippedX.length() != strippedY.length()) {
            return Integer.compare(strippedX.length(), strippedY.length());
        }
        int cmp = strippedX.compareTo(strippedY);
        if (cmp != 0) {
            return cmp;
        }
        // "01" after "1" keeps the order total
        return Integer.compare(x.length(), y.length());
    }

    private static String stripLeadingZeros(String digits) {
        int k = 0;
        while (k < digits.length() - 1 && digits.charAt(k) == '0') {
            k++;
        }
        return digits.substring(k);
    }
}
