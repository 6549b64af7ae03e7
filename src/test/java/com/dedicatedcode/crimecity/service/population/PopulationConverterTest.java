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

package com.dedicatedcode.crimecity.service.population;

import com.dedicatedcode.crimecity.model.PopulationCount;
import com.dedicatedcode.crimecity.model.PopulationGridCell;
import com.dedicatedcode.crimecity.model.SpatialCell;
import com.dedicatedcode.crimecity.service.spatial.GeodeticReprojector;
import com.dedicatedcode.crimecity.service.spatial.H3SpatialIndexer;
import com.dedicatedcode.crimecity.service.spatial.TransverseMercatorReprojector;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PopulationConverterTest {

    private final GeometryFactory geometryFactory = new GeometryFactory();
    private final H3SpatialIndexer indexer = new H3SpatialIndexer();
    private final TransverseMercatorReprojector sweref = TransverseMercatorReprojector.sweref99Tm();

    @Test
    void testSquaresAreAssignedByCentroid() {
        List<PopulationGridCell> grid = List.of(
                new PopulationGridCell(square(59.3303, 18.0586), 1200, 610, 590),
                new PopulationGridCell(square(59.3303, 18.0586), 300, 150, 150),
                new PopulationGridCell(square(57.7089, 11.9746), 800, 400, 400));

        PopulationConversion conversion = new PopulationConverter(sweref, indexer).convert(grid.stream(), 5);

        String stockholm = indexer.cellForPoint(59.3303, 18.0586, 5).map(SpatialCell::id).orElseThrow();
        PopulationCount stockholmCount = conversion.cells().stream()
                .filter(c -> c.cell().equals(stockholm))
                .findFirst()
                .orElseThrow();
        assertEquals(2, conversion.cells().size());
        assertEquals(1500, stockholmCount.population());
        assertEquals(760, stockholmCount.female());
        assertEquals(740, stockholmCount.male());
        assertEquals(2300, conversion.totalPopulation());
        assertEquals(3, conversion.gridRows());
    }

    @Test
    void testEmptySquaresAreSkipped() {
        List<PopulationGridCell> grid = List.of(
                new PopulationGridCell(square(63.8258, 20.2630), 0, 0, 0),
                new PopulationGridCell(square(63.8258, 20.2630), -1, 0, 0),
                new PopulationGridCell(square(63.8258, 20.2630), 5, 3, 2));

        PopulationConversion conversion = new PopulationConverter(sweref, indexer).convert(grid.stream(), 6);

        assertEquals(2, conversion.emptyRows());
        assertEquals(1, conversion.cells().size());
        assertEquals(5, conversion.totalPopulation());
    }

    @Test
    void testUnmappableSquaresAreCounted() {
        Polygon outside = geometryFactory.createPolygon(new Coordinate[]{
                new Coordinate(10, 95), new Coordinate(11, 95), new Coordinate(11, 96),
                new Coordinate(10, 96), new Coordinate(10, 95)});

        PopulationConversion conversion = new PopulationConverter(new GeodeticReprojector(), indexer)
                .convert(Stream.of(new PopulationGridCell(outside, 40, 20, 20)), 4);

        assertTrue(conversion.cells().isEmpty());
        assertEquals(1, conversion.unmappableRows());
    }

    @Test
    void testCellsAreSortedById() {
        List<PopulationGridCell> grid = List.of(
                new PopulationGridCell(square(67.8558, 20.2253), 10, 5, 5),
                new PopulationGridCell(square(55.6050, 13.0038), 10, 5, 5),
                new PopulationGridCell(square(59.8586, 17.6389), 10, 5, 5));

        List<PopulationCount> cells = new PopulationConverter(sweref, indexer).convert(grid.stream(), 5).cells();

        for (int i = 1; i < cells.size(); i++) {
            assertTrue(cells.get(i - 1).cell().compareTo(cells.get(i).cell()) < 0);
        }
    }

    @Test
    void testResolutionIsValidated() {
        PopulationConverter converter = new PopulationConverter(sweref, indexer);

        assertThrows(IllegalArgumentException.class, () -> converter.convert(Stream.empty(), 16));
    }

    /**
     * A 1km SWEREF99 TM grid square centered on the given position.
     */
    private Polygon square(double lat, double lon) {
        double[] center = sweref.fromGeodetic(lat, lon);
        double e = center[0] - 500;
        double n = center[1] - 500;
        return geometryFactory.createPolygon(new Coordinate[]{
                new Coordinate(e, n),
                new Coordinate(e + 1000, n),
                new Coordinate(e + 1000, n + 1000),
                new Coordinate(e, n + 1000),
                new Coordinate(e, n)});
    }
}
