/*-
 * #%L
 * Software for the radiometric calibration and fake-color rendering
 * of hyperspectral scan cubes.
 * %%
 * Copyright (C) 2024 - 2025 Hyperspectral Calibration developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.hyperspectral.process.calibration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import net.preibisch.hyperspectral.data.AnnotationRectangle;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.data.SpectralCube;
import net.preibisch.hyperspectral.data.annotations.Contour;
import net.preibisch.hyperspectral.data.annotations.ContoursManager;
import net.preibisch.hyperspectral.data.annotations.OpexAnnotationsIO;
import net.preibisch.hyperspectral.io.N5SpectralCubeIO;
import net.preibisch.hyperspectral.process.CalibrationException;
import net.preibisch.hyperspectral.process.export.DisplayImage;
import net.preibisch.hyperspectral.process.normalization.Channel;
import net.preibisch.hyperspectral.process.normalization.ObjectAnnotationsNormalization;
import net.preibisch.hyperspectral.process.normalization.SimpleNormalization;
import net.preibisch.hyperspectral.process.preprocessing.DownsamplePreprocessor;
import net.preibisch.hyperspectral.process.preprocessing.MultiPreprocessor;
import net.preibisch.hyperspectral.process.preprocessing.Preprocessor;
import net.preibisch.hyperspectral.process.preprocessing.SubtractAnnotationAveragePreprocessor;
import net.preibisch.hyperspectral.process.reference.AnnotationAverageReference;
import net.preibisch.hyperspectral.process.reference.AverageReference;
import net.preibisch.hyperspectral.process.reference.ReferenceType;
import net.preibisch.hyperspectral.process.reference.SameSizeReference;
import net.preibisch.hyperspectral.process.reference.locator.FilePatternLocator;
import net.preibisch.hyperspectral.process.reference.locator.FixedLocator;
import net.preibisch.hyperspectral.process.reference.locator.FromAnnotationLocator;
import net.preibisch.hyperspectral.process.reference.locator.ManualLocator;

public class CalibrationManagerTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	CalibrationManager manager;

	@Before
	public void setup()
	{
		manager = new CalibrationManager();
	}

	/**
	 * @return 3x2 cube with 2 bands and value 1 + 5 * ( x + 3 * y + 6 * band )
	 */
	static SpectralCube scan()
	{
		final Img< FloatType > img = Cubes.create( 3, 2, 2 );
		final Cursor< FloatType > c = img.localizingCursor();

		while ( c.hasNext() )
		{
			c.fwd();
			c.get().set( 1 + 5 * ( c.getIntPosition( 0 ) + 3 * c.getIntPosition( 1 ) + 6 * c.getIntPosition( 2 ) ) );
		}

		return new SpectralCube( img );
	}

	static float get( final RandomAccessibleInterval< FloatType > cube, final int x, final int y, final int b )
	{
		final RandomAccess< FloatType > ra = cube.randomAccess();
		ra.setPosition( new long[]{ x, y, b } );
		return ra.get().get();
	}

	static int get( final Img< UnsignedByteType > rgb, final int x, final int y, final int c )
	{
		final RandomAccess< UnsignedByteType > ra = rgb.randomAccess();
		ra.setPosition( new long[]{ x, y, c } );
		return ra.get().get();
	}

	static Contour square( final String label, final double from, final double to )
	{
		return new Contour( Arrays.asList(
				new double[]{ from, from }, new double[]{ to, from }, new double[]{ to, to }, new double[]{ from, to } ), label );
	}

	void configureSameSizeReferences()
	{
		manager.setBlackReferenceMethod( new SameSizeReference( ReferenceType.BLACK ) );
		manager.setWhiteReferenceMethod( new SameSizeReference( ReferenceType.WHITE ) );
		assertNull( manager.setBlackReferenceData( Cubes.filled( 3, 2, 2, 1 ) ) );
		assertNull( manager.setWhiteReferenceData( Cubes.filled( 3, 2, 2, 5 ) ) );
	}

	@Test
	public void testCalculationIsCached()
	{
		manager.setScan( scan(), null );

		final CalibrationOutcome first = manager.calcNormData();
		assertEquals( "D:" + CalibrationOutcome.SUCCESS, first.indicator() );
		assertSame( manager.getScan(), manager.getNormData() );

		final SpectralCube normData = manager.getNormData();
		final CalibrationOutcome second = manager.calcNormData();

		assertTrue( second.isEmpty() );
		assertEquals( "", CalibrationManager.calcNormDataIndicator( second ) );
		assertSame( normData, manager.getNormData() );
	}

	void assertRecalculated()
	{
		assertFalse( manager.isCalculated() );
		assertFalse( manager.calcNormData().isEmpty() );
		assertTrue( manager.isCalculated() );
	}

	@Test
	public void testSettersInvalidateCache() throws Exception
	{
		final String blackPath = new File( folder.getRoot(), "black.n5" ).getAbsolutePath();
		new N5SpectralCubeIO().save( new SpectralCube( Cubes.filled( 3, 2, 2, 1 ) ), blackPath );

		final String contoursPath = new File( folder.getRoot(), "contours.json" ).getAbsolutePath();
		final ContoursManager contours = new ContoursManager();
		contours.add( square( ContoursManager.LABEL_WHITEREF, 0.25, 0.75 ) );
		OpexAnnotationsIO.save( contours.toObjectPredictions( 3, 2 ), contoursPath );

		manager.setScan( scan(), null );
		manager.calcNormData();

		manager.setPreprocessor( null );
		assertRecalculated();

		manager.setNormalization( new SimpleNormalization() );
		assertRecalculated();

		manager.setBlackReferenceMethod( new SameSizeReference( ReferenceType.BLACK ) );
		assertRecalculated();

		manager.setWhiteReferenceMethod( new SameSizeReference( ReferenceType.WHITE ) );
		assertRecalculated();

		manager.setWhiteReferenceData( Cubes.filled( 3, 2, 2, 1 ) );
		assertRecalculated();

		assertNull( manager.loadBlackReference( blackPath ) );
		assertRecalculated();
		assertEquals( blackPath, manager.getBlackReference().getFile() );

		manager.setBlackReferenceLocator( new ManualLocator() );
		assertRecalculated();

		manager.setWhiteReferenceLocator( new ManualLocator() );
		assertRecalculated();

		manager.setBlackReferenceAnnotation( new AnnotationRectangle( 0, 0, 1, 1 ), true );
		assertRecalculated();

		assertNull( manager.loadContours( contoursPath ) );
		assertRecalculated();
		assertEquals( 1, manager.getContours().getContours( ContoursManager.LABEL_WHITEREF ).size() );

		manager.clearWhiteReference();
		assertRecalculated();

		manager.setScan( scan(), null );
		assertRecalculated();
	}

	@Test
	public void testBlackAndWhiteReference()
	{
		manager.setScan( scan(), null );
		configureSameSizeReferences();

		final CalibrationOutcome outcome = manager.calcNormData();

		assertEquals( "B:✔ W:✔ D:✔", outcome.indicator() );
		assertEquals( Boolean.TRUE, outcome.get( CalibrationStage.BLACKREF_APPLIED ) );
		assertEquals( Boolean.FALSE, outcome.get( CalibrationStage.DIMENSIONS_DIFFER ) );
		assertFalse( outcome.contains( CalibrationStage.BLACKDATA_INITIALIZED ) );

		final RandomAccessibleInterval< FloatType > normData = manager.getNormData().getData();
		assertEquals( 0, get( normData, 0, 0, 0 ), 1e-6 );
		assertEquals( 4, get( normData, 1, 1, 0 ), 1e-6 );
		assertEquals( 11, get( normData, 2, 1, 1 ), 1e-6 );

		// the scan is left untouched
		assertEquals( 1, get( manager.getScan().getData(), 0, 0, 0 ), 0 );
	}

	@Test
	public void testFailingReferenceKeepsLastCube()
	{
		manager.setScan( scan(), null );
		configureSameSizeReferences();
		manager.setBlackReferenceData( Cubes.filled( 2, 2, 2, 1 ) );

		final CalibrationOutcome outcome = manager.calcNormData();

		assertEquals( "B:❌ D:✔", outcome.indicator() );
		assertFalse( outcome.contains( CalibrationStage.WHITEREF_APPLIED ) );
		assertSame( manager.getScan(), manager.getNormData() );
	}

	@Test
	public void testFailingLocator()
	{
		manager.setScan( scan(), null );
		manager.setBlackReferenceLocator( new FixedLocator() );

		final CalibrationOutcome outcome = manager.calcNormData();

		assertEquals( "I:❌", outcome.indicator() );
		assertFalse( manager.isCalculated() );
		assertNull( manager.dims() );

		manager.updateImage( 0, 0, 0 );
		assertNull( manager.getDisplayImage() );
	}

	@Test
	public void testLocatorWithoutResult()
	{
		manager.setScan( scan(), null );
		manager.setBlackReferenceLocator( new ManualLocator() );
		manager.setBlackReferenceMethod( new AverageReference( ReferenceType.BLACK ) );

		assertEquals( "I:✔ D:✔", manager.calcNormData().indicator() );
		assertFalse( manager.getBlackReference().hasData() );
	}

	@Test
	public void testFilePatternLocator() throws Exception
	{
		final N5SpectralCubeIO io = new N5SpectralCubeIO();
		final String scanPath = new File( folder.getRoot(), "scan.n5" ).getAbsolutePath();
		final String darkPath = new File( folder.getRoot(), "scan-dark.n5" ).getAbsolutePath();

		io.save( scan(), scanPath );
		io.save( new SpectralCube( Cubes.filled( 1, 1, 2, 1 ) ), darkPath );

		assertNull( manager.loadScan( scanPath ) );
		assertEquals( scanPath, manager.getScanFile() );

		final FilePatternLocator locator = new FilePatternLocator( "{PATH}/{NAME}-dark{EXT}" );
		locator.setMustExist( true );
		manager.setBlackReferenceLocator( locator );
		manager.setBlackReferenceMethod( new AverageReference( ReferenceType.BLACK ) );

		final CalibrationOutcome outcome = manager.calcNormData();

		assertEquals( "I:✔ B:✔ D:✔", outcome.indicator() );
		assertEquals( darkPath, manager.getBlackReference().getFile() );
		assertEquals( 0, get( manager.getNormData().getData(), 0, 0, 0 ), 1e-6 );
		assertEquals( 55, get( manager.getNormData().getData(), 2, 1, 1 ), 1e-6 );

		// reference data is present now, the locator does not run again
		manager.resetNormData();
		assertEquals( "B:✔ D:✔", manager.calcNormData().indicator() );
	}

	@Test
	public void testFixedLocator() throws Exception
	{
		final String whitePath = new File( folder.getRoot(), "white.n5" ).getAbsolutePath();
		new N5SpectralCubeIO().save( new SpectralCube( Cubes.filled( 3, 2, 2, 5 ) ), whitePath );

		manager.setScan( scan(), null );
		manager.setWhiteReferenceLocator( new FixedLocator( whitePath ) );
		manager.setWhiteReferenceMethod( new SameSizeReference( ReferenceType.WHITE ) );

		assertEquals( "I:✔ W:✔ D:✔", manager.calcNormData().indicator() );
		assertEquals( 0.2, get( manager.getNormData().getData(), 0, 0, 0 ), 1e-6 );
	}

	@Test
	public void testAnnotationLocator()
	{
		// 4x4, 2 bands: 4 everywhere except for the white reference area [1, 3) x [1, 3)
		final Img< FloatType > img = Cubes.filled( 4, 4, 2, 4 );

		for ( final FloatType t : Views.interval( img, new long[]{ 1, 1, 0 }, new long[]{ 2, 2, 1 } ) )
			t.set( 2 );

		manager.setScan( new SpectralCube( img ), null );
		manager.getContours().add( square( ContoursManager.LABEL_WHITEREF, 0.25, 0.75 ) );
		manager.setWhiteReferenceLocator( new FromAnnotationLocator( ContoursManager.LABEL_WHITEREF ) );
		manager.setWhiteReferenceMethod( new AnnotationAverageReference( ReferenceType.WHITE ) );

		final CalibrationOutcome outcome = manager.calcNormData();

		assertEquals( "I:✔ W:✔ D:✔", outcome.indicator() );
		assertEquals( new AnnotationRectangle( 1, 1, 3, 3 ), manager.getWhiteReference().getAnnotation() );
		assertTrue( manager.getWhiteReference().isAnnotationInScan() );
		assertEquals( 2, get( manager.getNormData().getData(), 0, 0, 0 ), 1e-6 );
		assertEquals( 1, get( manager.getNormData().getData(), 2, 2, 1 ), 1e-6 );
	}

	@Test
	public void testWhiteAnnotationInScanUsesRawScan()
	{
		manager.setScan( new SpectralCube( Cubes.filled( 3, 2, 2, 10 ) ), null );
		manager.setBlackReferenceMethod( new SameSizeReference( ReferenceType.BLACK ) );
		assertNull( manager.setBlackReferenceData( Cubes.filled( 3, 2, 2, 2 ) ) );
		manager.setWhiteReferenceMethod( new AnnotationAverageReference( ReferenceType.WHITE ) );
		assertNull( manager.setWhiteReferenceAnnotation( new AnnotationRectangle( 0, 0, 1, 1 ), true ) );

		final CalibrationOutcome outcome = manager.calcNormData();

		// white average is taken from the raw scan (10), not from the black corrected cube (8)
		assertEquals( "B:✔ W:✔ D:✔", outcome.indicator() );
		assertEquals( 0.8, get( manager.getNormData().getData(), 0, 0, 0 ), 1e-6 );
		assertEquals( 0.8, get( manager.getNormData().getData(), 2, 1, 1 ), 1e-6 );
	}

	@Test
	public void testAnnotationWithoutLocatorOrAnnotation()
	{
		manager.setScan( scan(), null );
		manager.setWhiteReferenceMethod( new AnnotationAverageReference( ReferenceType.WHITE ) );

		final CalibrationOutcome outcome = manager.calcNormData();

		assertFalse( outcome.contains( CalibrationStage.WHITEREF_APPLIED ) );
		assertSame( manager.getScan(), manager.getNormData() );
	}

	@Test
	public void testAnnotationInSeparateReference()
	{
		// black reference of a different size, only the annotated area [0, 2) x [0, 1) is used: 3 and 5
		final Img< FloatType > black = Cubes.filled( 5, 5, 2, 100 );
		final RandomAccess< FloatType > ra = black.randomAccess();
		for ( int b = 0; b < 2; ++b )
		{
			ra.setPosition( new long[]{ 0, 0, b } );
			ra.get().set( 3 );
			ra.setPosition( new long[]{ 1, 0, b } );
			ra.get().set( 5 );
		}

		manager.setScan( scan(), null );
		manager.setBlackReferenceMethod( new AnnotationAverageReference( ReferenceType.BLACK ) );
		manager.setBlackReferenceData( black );
		manager.setBlackReferenceAnnotation( new AnnotationRectangle( 0, 0, 1, 2 ), false );

		assertTrue( manager.getBlackReference().hasData() );
		assertEquals( "B:✔ D:✔", manager.calcNormData().indicator() );
		assertEquals( 2, get( manager.getNormData().getData(), 1, 0, 0 ), 1e-6 );

		// an annotation inside the scan replaces the reference data
		manager.setBlackReferenceAnnotation( new AnnotationRectangle( 0, 0, 1, 1 ), true );
		assertFalse( manager.getBlackReference().hasData() );
		assertEquals( "B:✔ D:✔", manager.calcNormData().indicator() );
		assertEquals( 5, get( manager.getNormData().getData(), 1, 0, 0 ), 1e-6 );
	}

	@Test
	public void testPreprocessingChangesDimensions()
	{
		manager.setScan( scan(), null );
		manager.setPreprocessor( new DownsamplePreprocessor() );

		final CalibrationOutcome outcome = manager.calcNormData();

		assertEquals( "P:✔ D:❌", outcome.indicator() );
		assertEquals( 2, manager.dims()[ 0 ] );
		assertEquals( 1, manager.dims()[ 1 ] );
		assertEquals( 2, manager.getNumBandsNorm() );
		assertEquals( Arrays.asList( 0.0, 1.0 ), manager.getWavelengths() );
		assertTrue( manager.getScan().getWavelengths().isEmpty() );
	}

	@Test
	public void testPreprocessingKeepsWavelengths()
	{
		manager.setScan( scan().copy( scan().getData(), Arrays.asList( 500.0, 600.0 ) ), null );
		manager.setPreprocessor( new DownsamplePreprocessor() );
		manager.calcNormData();

		assertEquals( Arrays.asList( 500.0, 600.0 ), manager.getWavelengths() );
	}

	@Test
	public void testPreprocessingWithMultipleOutputs()
	{
		manager.setScan( scan(), null );
		manager.setPreprocessor( new Preprocessor()
		{
			@Override
			public String getName() { return "twice"; }

			@Override
			public String getDescription() { return "returns the input twice"; }

			@Override
			public List< SpectralCube > apply( final SpectralCube data )
			{
				return Arrays.asList( data, data );
			}
		} );

		assertEquals( "P:✔ D:✔", manager.calcNormData().indicator() );
		assertSame( manager.getScan(), manager.getNormData() );
	}

	@Test
	public void testPreprocessorsReceiveAnnotations()
	{
		final SubtractAnnotationAveragePreprocessor subtract = new SubtractAnnotationAveragePreprocessor( "leaf" );

		manager.setScan( new SpectralCube( Cubes.filled( 4, 4, 1, 7 ) ), null );
		manager.getContours().add( square( "leaf", 0.0, 0.5 ) );
		manager.setPreprocessor( new MultiPreprocessor( subtract ) );

		assertEquals( "P:✔ D:✔", manager.calcNormData().indicator() );
		assertNotNull( subtract.getAnnotations() );
		assertEquals( "leaf", subtract.getAnnotations().getObjects().get( 0 ).getLabel() );
		assertEquals( 0, get( manager.getNormData().getData(), 3, 3, 0 ), 1e-6 );
	}

	@Test
	public void testLoadMissingScan()
	{
		final String msg = manager.loadScan( new File( folder.getRoot(), "missing.n5" ).getAbsolutePath() );

		assertNotNull( msg );
		assertFalse( manager.hasScan() );
	}

	@Test
	public void testWavelengthMismatch()
	{
		assertNotNull( manager.setScan( scan().copy( scan().getData(), Collections.singletonList( 400.0 ) ), "scan" ) );
		assertTrue( manager.hasScan() );
		assertNull( manager.setScan( scan(), "scan" ) );
	}

	@Test
	public void testNoScan() throws Exception
	{
		assertEquals( CalibrationManager.MSG_NO_SCAN, manager.loadBlackReference( "/does/not/matter" ) );
		assertEquals( CalibrationManager.MSG_NO_SCAN, manager.setWhiteReferenceData( Cubes.filled( 1, 1, 1, 1 ) ) );
		assertEquals( CalibrationManager.MSG_NO_SCAN, manager.setBlackReferenceAnnotation( new AnnotationRectangle( 0, 0, 1, 1 ), true ) );
		assertEquals( CalibrationManager.MSG_NO_SCAN, manager.loadContours( "/does/not/matter" ) );

		assertTrue( manager.calcNormData().isEmpty() );
		assertTrue( manager.updateImage( 0, 1, 2 ).isEmpty() );
		assertNull( manager.getDisplayImage() );
		assertEquals( 0, manager.getNumBandsScan() );
		assertTrue( manager.getWavelengths().isEmpty() );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testWrongReferenceType()
	{
		manager.setBlackReferenceMethod( new AverageReference( ReferenceType.WHITE ) );
	}

	@Test
	public void testDisplayImageUsesSimpleNormalizationByDefault()
	{
		manager.setScan( scan(), null );
		manager.updateImage( 0, 1, 0 );

		final SimpleNormalization norm = new SimpleNormalization();
		final Img< UnsignedByteType > expected = DisplayImage.toDisplayImage( Arrays.asList(
				norm.normalize( manager.getScan().band( 0 ), Channel.RED ),
				norm.normalize( manager.getScan().band( 1 ), Channel.GREEN ),
				norm.normalize( manager.getScan().band( 0 ), Channel.BLUE ) ) );

		final Img< UnsignedByteType > rgb = manager.getDisplayImage();
		final Cursor< UnsignedByteType > c = expected.localizingCursor();
		final RandomAccess< UnsignedByteType > ra = rgb.randomAccess();

		while ( c.hasNext() )
		{
			c.fwd();
			ra.setPosition( c );
			assertEquals( c.get().get(), ra.get().get() );
		}

		assertEquals( 255, get( rgb, 2, 1, 0 ) );
		assertEquals( 0, get( rgb, 0, 0, 1 ) );
	}

	@Test
	public void testBandIndicesAreClamped()
	{
		final Img< FloatType > img = Cubes.create( 2, 2, 2 );
		for ( final FloatType t : Views.flatIterable( Cubes.band( img, 0 ) ) )
			t.set( 0.2f );
		for ( final FloatType t : Views.flatIterable( Cubes.band( img, 1 ) ) )
			t.set( 0.6f );

		manager.setScan( new SpectralCube( img ), null );
		manager.setNormalization( null );
		manager.updateImage( -5, 1, 99 );

		final Img< UnsignedByteType > rgb = manager.getDisplayImage();
		assertEquals( 51, get( rgb, 1, 1, 0 ) );
		assertEquals( 153, get( rgb, 1, 1, 1 ) );
		assertEquals( 153, get( rgb, 1, 1, 2 ) );
	}

	@Test
	public void testFailingNormalizationShowsRawBands()
	{
		manager.setScan( new SpectralCube( Cubes.filled( 2, 2, 1, 0.5f ) ), null );
		manager.setNormalization( new ObjectAnnotationsNormalization() );

		final CalibrationOutcome outcome = manager.updateImage( 0, 0, 0 );

		assertEquals( "D:✔", outcome.indicator() );
		assertEquals( 127, get( manager.getDisplayImage(), 0, 0, 0 ) );
		assertEquals( 127, get( manager.getDisplayImage(), 1, 1, 2 ) );
	}

	@Test
	public void testOutputImage() throws Exception
	{
		final File file = new File( folder.getRoot(), "out.png" );

		manager.setScan( scan(), null );
		manager.outputImage( 0, 1, 1, file.getAbsolutePath(), 6, 4 );

		assertTrue( file.exists() );
		assertNotNull( manager.getDisplayImage() );
	}

	@Test( expected = CalibrationException.class )
	public void testOutputImageWithoutScan() throws Exception
	{
		manager.outputImage( 0, 1, 1, new File( folder.getRoot(), "out.png" ).getAbsolutePath(), 0, 0 );
	}

	@Test
	public void testStatisticsAndState()
	{
		manager.setScan( scan(), "/data/scan.n5" );
		configureSameSizeReferences();
		manager.calcNormData();

		final Map< String, Double > stats = manager.statistics();
		assertEquals( 1, stats.get( "scan.min" ), 0 );
		assertEquals( 56, stats.get( "scan.max" ), 0 );
		assertEquals( 1, stats.get( "blackref.max" ), 0 );
		assertEquals( 5, stats.get( "whiteref.min" ), 0 );

		final String state = manager.dumpState();
		assertTrue( state.contains( "scan file: /data/scan.n5" ) );
		assertTrue( state.contains( "scan shape: (2, 3, 2)" ) );
		assertTrue( state.contains( "black reference method: " + manager.getBlackReference().getMethod() ) );
		assertTrue( state.contains( "normalization: norm-simple" ) );
		assertTrue( state.contains( "scan.max: 56.0" ) );
	}

	@Test
	public void testClearAll()
	{
		manager.setScan( scan(), null );
		configureSameSizeReferences();
		manager.getContours().add( square( "leaf", 0.0, 0.5 ) );
		manager.calcNormData();

		manager.clearAll();

		assertFalse( manager.hasScan() );
		assertFalse( manager.isCalculated() );
		assertFalse( manager.getBlackReference().hasData() );
		assertFalse( manager.getWhiteReference().hasData() );
		assertFalse( manager.getContours().hasAnnotations() );
	}
}
