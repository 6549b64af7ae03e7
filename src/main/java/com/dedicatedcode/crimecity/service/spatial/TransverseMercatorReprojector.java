/*
 *  This file is part of crimecity.
 *
 *  CrimeCity is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  CrimeCity is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with CrimeCity. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.crimecity.service.spatial;

import com.dedicatedcode.crimecity.model.LatLon;

/**
 * Gauss-Krüger transverse mercator projection on an ellipsoid, in both directions.
 * <p>
 * Uses the series expansion published by Lantmäteriet for SWEREF99, accurate to well below a
 * millimeter inside the projection zone.
 */
public class TransverseMercatorReprojector implements CoordinateReprojector {

    private static final double GRS80_AXIS = 6378137.0;
    private static final double GRS80_FLATTENING = 1.0 / 298.257222101;

    private final String crs;
    private final double centralMeridian;
    private final double scale;
    private final double falseNorthing;
    private final double falseEasting;

    private final double aRoof;
    private final double a, b, c, d;
    private final double beta1, beta2, beta3, beta4;
    private final double aStar, bStar, cStar, dStar;
    private final double delta1, delta2, delta3, delta4;

    public TransverseMercatorReprojector(String crs,
                                         double axis,
                                         double flattening,
                                         double centralMeridianDegrees,
                                         double scale,
                                         double falseNorthing,
                                         double falseEasting) {
        this.crs = crs;
        this.centralMeridian = Math.toRadians(centralMeridianDegrees);
        this.scale = scale;
        this.falseNorthing = falseNorthing;
        this.falseEasting = falseEasting;

        double e2 = flattening * (2.0 - flattening);
        double n = flattening / (2.0 - flattening);
        double n2 = n * n;
        double n3 = n2 * n;
        double n4 = n3 * n;
        this.aRoof = axis / (1.0 + n) * (1.0 + n2 / 4.0 + n4 / 64.0);

        this.a = e2;
        this.b = (5.0 * e2 * e2 - e2 * e2 * e2) / 6.0;
        this.c = (104.0 * e2 * e2 * e2 - 45.0 * e2 * e2 * e2 * e2) / 120.0;
        this.d = (1237.0 * e2 * e2 * e2 * e2) / 1260.0;
        this.beta1 = n / 2.0 - 2.0 * n2 / 3.0 + 5.0 * n3 / 16.0 + 41.0 * n4 / 180.0;
        this.beta2 = 13.0 * n2 / 48.0 - 3.0 * n3 / 5.0 + 557.0 * n4 / 1440.0;
        this.beta3 = 61.0 * n3 / 240.0 - 103.0 * n4 / 140.0;
        this.beta4 = 49561.0 * n4 / 161280.0;

        this.aStar = e2 + e2 * e2 + e2 * e2 * e2 + e2 * e2 * e2 * e2;
        this.bStar = -(7.0 * e2 * e2 + 17.0 * e2 * e2 * e2 + 30.0 * e2 * e2 * e2 * e2) / 6.0;
        this.cStar = (224.0 * e2 * e2 * e2 + 889.0 * e2 * e2 * e2 * e2) / 120.0;
        this.dStar = -(4279.0 * e2 * e2 * e2 * e2) / 1260.0;
        this.delta1 = n / 2.0 - 2.0 * n2 / 3.0 + 37.0 * n3 / 96.0 - n4 / 360.0;
        this.delta2 = n2 / 48.0 + n3 / 15.0 - 437.0 * n4 / 1440.0;
        this.delta3 = 17.0 * n3 / 480.0 - 37.0 * n4 / 840.0;
        this.delta4 = 4397.0 * n4 / 161280.0;
    }

    /**
     * SWEREF99 TM (EPSG:3006), the reference system of the SCB population grid.
     */
    public static TransverseMercatorReprojector sweref99Tm() {
        return new TransverseMercatorReprojector(ReferenceSystems.SWEREF99_TM,
                GRS80_AXIS, GRS80_FLATTENING, 15.0, 0.9996, 0.0, 500_000.0);
    }

    @Override
    public String sourceCrs() {
        return crs;
    }

    @Override
    public LatLon toGeodetic(double easting, double northing) {
        double xi = (northing - falseNorthing) / (scale * aRoof);
        double eta = (easting - falseEasting) / (scale * aRoof);

        double xiPrim = xi
                - delta1 * Math.sin(2.0 * xi) * Math.cosh(2.0 * eta)
                - delta2 * Math.sin(4.0 * xi) * Math.cosh(4.0 * eta)
                - delta3 * Math.sin(6.0 * xi) * Math.cosh(6.0 * eta)
                - delta4 * Math.sin(8.0 * xi) * Math.cosh(8.0 * eta);
        double etaPrim = eta
                - delta1 * Math.cos(2.0 * xi) * Math.sinh(2.0 * eta)
                - delta2 * Math.cos(4.0 * xi) * Math.sinh(4.0 * eta)
                - delta3 * Math.cos(6.0 * xi) * Math.sinh(6.0 * eta)
                - delta4 * Math.cos(8.0 * xi) * Math.sinh(8.0 * eta);

        double phiStar = Math.asin(Math.sin(xiPrim) / Math.cosh(etaPrim));
        double deltaLambda = Math.atan(Math.sinh(etaPrim) / Math.cos(xiPrim));

        double sinPhi = Math.sin(phiStar);
        double sin2 = sinPhi * sinPhi;
        double phi = phiStar + sinPhi * Math.cos(phiStar)
                * (aStar + bStar * sin2 + cStar * sin2 * sin2 + dStar * sin2 * sin2 * sin2);

        return new LatLon(Math.toDegrees(phi), Math.toDegrees(centralMeridian + deltaLambda));
    }

    /**
     * Projects geodetic coordinates into this reference system.
     *
     * @return {easting, northing}
     */
    public double[] fromGeodetic(double lat, double lon) {
        double phi = Math.toRadians(lat);
        double lambda = Math.toRadians(lon);

        double sinPhi = Math.sin(phi);
        double sin2 = sinPhi * sinPhi;
        double phiStar = phi - sinPhi * Math.cos(phi) * (a + b * sin2 + c * sin2 * sin2 + d * sin2 * sin2 * sin2);
        double deltaLambda = lambda - centralMeridian;
        double xiPrim = Math.atan(Math.tan(phiStar) / Math.cos(deltaLambda));
        double etaPrim = atanh(Math.cos(phiStar) * Math.sin(deltaLambda));

        double northing = scale * aRoof * (xiPrim
                + beta1 * Math.sin(2.0 * xiPrim) * Math.cosh(2.0 * etaPrim)
                + beta2 * Math.sin(4.0 * xiPrim) * Math.cosh(4.0 * etaPrim)
                + beta3 * Math.sin(6.0 * xiPrim) * Math.cosh(6.0 * etaPrim)
                + beta4 * Math.sin(8.0 * xiPrim) * Math.cosh(8.0 * etaPrim)) + falseNorthing;
        double easting = scale * aRoof * (etaPrim
                + beta1 * Math.cos(2.0 * xiPrim) * Math.sinh(2.0 * etaPrim)
                + beta2 * Math.cos(4.0 * xiPrim) * Math.sinh(4.0 * etaPrim)
                + beta3 * Math.cos(6.0 * xiPrim) * Math.sinh(6.0 * etaPrim)
                + beta4 * Math.cos(8.0 * xiPrim) * Math.sinh(8.0 * etaPrim)) + falseEasting;
        return new double[]{easting, northing};
    }

    private static double atanh(double value) {
        return 0.5 * Math.log((1.0 + value) / (1.0 - value));
    }
}
