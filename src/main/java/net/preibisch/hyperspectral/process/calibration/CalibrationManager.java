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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.hyperspectral.data.AnnotationRectangle;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.data.SpectralCube;
import net.preibisch.hyperspectral.data.annotations.ContoursManager;
import net.preibisch.hyperspectral.data.annotations.ObjectPrediction;
import net.preibisch.hyperspectral.data.annotations.ObjectPredictions;
import net.preibisch.hyperspectral.data.annotations.OpexAnnotationsIO;
import net.preibisch.hyperspectral.io.N5SpectralCubeIO;
import net.preibisch.hyperspectral.io.SpectralCubeLoader;
import net.preibisch.hyperspectral.process.CalibrationException;
import net.preibisch.hyperspectral.process.export.DisplayImage;
import net.preibisch.hyperspectral.process.normalization.AnnotationBasedNormalization;
import net.preibisch.hyperspectral.process.normalization.Channel;
import net.preibisch.hyperspectral.process.normalization.Normalization;
import net.preibisch.hyperspectral.process.normalization.SimpleNormalization;
import net.preibisch.hyperspectral.process.preprocessing.AnnotationAware;
import net.preibisch.hyperspectral.process.preprocessing.MultiPreprocessor;
import net.preibisch.hyperspectral.process.preprocessing.Preprocessor;
import net.preibisch.hyperspectral.process.reference.AnnotationBasedReferenceMethod;
import net.preibisch.hyperspectral.process.reference.ReferenceMethod;
import net.preibisch.hyperspectral.process.reference.ReferenceType;
import net.preibisch.hyperspectral.process.reference.locator.AnnotationBasedReferenceLocator;
import net.preibisch.hyperspectral.process.reference.locator.FileBasedReferenceLocator;
import net.preibisch.hyperspectral.process.reference.locator.ReferenceLocator;

/**
 * Owns a scan together with its black/white references, annotations, preprocessing and normalization,
 * and computes the calibrated cube and the fake-color display image from them.
 * <p>
 * The calibrated cube is cached; every setter that affects it clears the cache. Instances are not thread-safe.
 */
public class CalibrationManager
{
	private static final Logger LOG = LoggerFactory.getLogger( CalibrationManager.class );

	public static final String MSG_NO_SCAN = "Please load a scan first!";

	final SpectralCubeLoader loader;

	String scanFile;
	SpectralCube scan;

	final ReferenceSlot black = new ReferenceSlot( ReferenceType.BLACK );
	final ReferenceSlot white = new ReferenceSlot( ReferenceType.WHITE );

	final ContoursManager contours = new ContoursManager();

	Preprocessor preprocessor;
	Normalization normalization = new SimpleNormalization();

	SpectralCube normData;
	Img< UnsignedByteType > displayImage;

	public CalibrationManager()
	{
		this( new N5SpectralCubeIO() );
	}

	public CalibrationManager( final SpectralCubeLoader loader )
	{
		this.loader = loader;
	}

	/*
	 * scan
	 */

	public boolean hasScan() { return scan != null; }
	public SpectralCube getScan() { return scan; }
	public String getScanFile() { return scanFile; }

	/**
	 * Loads the scan and clears the calibrated data.
	 *
	 * @param path - the scan to load
	 * @return null if successfully loaded, otherwise an error/warning message
	 */
	public String loadScan( final String path )
	{
		final SpectralCube cube;

		try
		{
			cube = loader.load( path );
		}
		catch ( final IOException e )
		{
			LOG.warn( "Failed to load scan: " + path, e );
			return "Failed to load scan: " + path + " (" + e.getMessage() + ")";
		}

		return setScan( cube, path );
	}

	/**
	 * Uses the cube as scan.
	 *
	 * @param cube - the scan
	 * @param file - the file the scan comes from, null if unknown
	 * @return null if successful, otherwise a warning message
	 */
	public String setScan( final SpectralCube cube, final String file )
	{
		this.scan = cube;
		this.scanFile = file;
		resetNormData();

		LOG.info( "Scan: {} from {}", cube, file );

		if ( cube.hasWavelengths() && cube.getWavelengths().size() != cube.numBands() )
			return "Number of defined wavelengths and number of bands in data differ: " + cube.getWavelengths().size() + " != " + cube.numBands();

		return null;
	}

	public void clearScan()
	{
		scan = null;
		scanFile = null;
		resetNormData();
	}

	public void clearAll()
	{
		clearScan();
		clearBlackReference();
		clearWhiteReference();
		contours.clear();
	}

	/**
	 * @return the number of bands in the scan, 0 if no scan present
	 */
	public int getNumBandsScan()
	{
		return scan == null ? 0 : scan.numBands();
	}

	/**
	 * @return the number of bands in the calibrated data, the bands of the scan if not calculated
	 */
	public int getNumBandsNorm()
	{
		return normData == null ? getNumBandsScan() : normData.numBands();
	}

	/**
	 * @return the wavelengths of the calibrated data if calculated, otherwise of the scan; empty without scan
	 */
	public List< Double > getWavelengths()
	{
		if ( normData != null )
			return normData.getWavelengths();
		else if ( scan != null )
			return scan.getWavelengths();
		else
			return Collections.emptyList();
	}

	/**
	 * @return width and height of the calibrated data, null if not calculated
	 */
	public int[] dims()
	{
		if ( normData == null )
			return null;

		return new int[]{ normData.width(), normData.height() };
	}

	/*
	 * annotations
	 */

	public ContoursManager getContours() { return contours; }

	/**
	 * Loads polygon annotations in OPEX JSON format.
	 *
	 * @param path - the JSON file
	 * @return null if successful, otherwise an error message
	 * @throws IOException if the file cannot be read or parsed
	 */
	public String loadContours( final String path ) throws IOException
	{
		if ( !hasScan() )
			return MSG_NO_SCAN;

		contours.fromObjectPredictions( OpexAnnotationsIO.load( path ), scan.width(), scan.height() );
		resetNormData();

		return null;
	}

	/*
	 * references
	 */

	public ReferenceSlot getBlackReference() { return black; }
	public ReferenceSlot getWhiteReference() { return white; }

	public void setBlackReferenceLocator( final ReferenceLocator< ? > locator ) { setLocator( black, locator ); }
	public void setWhiteReferenceLocator( final ReferenceLocator< ? > locator ) { setLocator( white, locator ); }

	public void setBlackReferenceMethod( final ReferenceMethod< ? > method ) { setMethod( black, method ); }
	public void setWhiteReferenceMethod( final ReferenceMethod< ? > method ) { setMethod( white, method ); }

	/**
	 * @return null if successful, otherwise an error message
	 */
	public String loadBlackReference( final String path ) { return loadReference( black, path ); }
	public String loadWhiteReference( final String path ) { return loadReference( white, path ); }

	/**
	 * Uses the data as black reference (instead of loading it from a file).
	 *
	 * @return null if successful, otherwise an error message
	 */
	public String setBlackReferenceData( final RandomAccessibleInterval< FloatType > data ) { return setReferenceData( black, data ); }
	public String setWhiteReferenceData( final RandomAccessibleInterval< FloatType > data ) { return setReferenceData( white, data ); }

	/**
	 * @param annotation - the region of the reference
	 * @param inScan - whether the region is inside the raw scan or inside separately supplied reference data
	 * @return null if successful, otherwise an error message
	 */
	public String setBlackReferenceAnnotation( final AnnotationRectangle annotation, final boolean inScan ) { return setReferenceAnnotation( black, annotation, inScan ); }
	public String setWhiteReferenceAnnotation( final AnnotationRectangle annotation, final boolean inScan ) { return setReferenceAnnotation( white, annotation, inScan ); }

	public void clearBlackReference() { clearReference( black ); }
	public void clearWhiteReference() { clearReference( white ); }

	protected void setLocator( final ReferenceSlot slot, final ReferenceLocator< ? > locator )
	{
		slot.locator = locator;
		resetNormData();
	}

	protected void setMethod( final ReferenceSlot slot, final ReferenceMethod< ? > method )
	{
		if ( method != null && method.getType() != slot.getType() )
			throw new IllegalArgumentException( "Cannot use " + method.getType().getLabel() + " reference method as " + slot.getType().getLabel() + " reference method: " + method );

		slot.method = method;
		resetNormData();
	}

	protected String loadReference( final ReferenceSlot slot, final String path )
	{
		if ( !hasScan() )
			return MSG_NO_SCAN;

		try
		{
			readReference( slot, path );
		}
		catch ( final IOException e )
		{
			LOG.warn( "Failed to load " + slot.getType().getLabel() + " reference: " + path, e );
			return "Failed to load " + slot.getType().getLabel() + " reference: " + path + " (" + e.getMessage() + ")";
		}

		resetNormData();
		return null;
	}

	protected void readReference( final ReferenceSlot slot, final String path ) throws IOException
	{
		slot.setData( path, loader.load( path ).getData() );
	}

	protected String setReferenceData( final ReferenceSlot slot, final RandomAccessibleInterval< FloatType > data )
	{
		if ( !hasScan() )
			return MSG_NO_SCAN;

		slot.setData( null, data );
		resetNormData();
		return null;
	}

	protected String setReferenceAnnotation( final ReferenceSlot slot, final AnnotationRectangle annotation, final boolean inScan )
	{
		if ( !hasScan() )
			return MSG_NO_SCAN;

		slot.setAnnotation( annotation, inScan );
		resetNormData();
		return null;
	}

	protected void clearReference( final ReferenceSlot slot )
	{
		slot.clearData();
		resetNormData();
	}

	/*
	 * preprocessing, normalization
	 */

	public Preprocessor getPreprocessor() { return preprocessor; }

	/**
	 * @param preprocessor - the preprocessing to apply after the references, null for none
	 */
	public void setPreprocessor( final Preprocessor preprocessor )
	{
		this.preprocessor = preprocessor;
		resetNormData();
	}

	public Normalization getNormalization() { return normalization; }

	/**
	 * @param normalization - the normalization for the display image, null to display the raw bands
	 */
	public void setNormalization( final Normalization normalization )
	{
		this.normalization = normalization;
		resetNormData();
	}

	/*
	 * calculation
	 */

	/**
	 * Forces a recalculation of the calibrated data.
	 */
	public void resetNormData()
	{
		normData = null;
	}

	public SpectralCube getNormData() { return normData; }

	public boolean isCalculated() { return normData != null; }

	/**
	 * Calculates the calibrated data if not already present: locates the references, applies black and white
	 * reference and the preprocessing. A failing stage ends the calculation, the data computed up to that stage is kept.
	 *
	 * @return the stages that were attempted and whether they succeeded, empty if nothing had to be calculated
	 */
	public CalibrationOutcome calcNormData()
	{
		final CalibrationOutcome outcome = new CalibrationOutcome();

		if ( normData != null || scan == null )
			return outcome;

		LOG.info( "Calculation: start" );

		final ArrayList< CalibrationStep > steps = new ArrayList<>();
		steps.add( initReferenceDataStep( black, CalibrationStage.BLACKDATA_INITIALIZED ) );
		steps.add( initReferenceDataStep( white, CalibrationStage.WHITEDATA_INITIALIZED ) );
		steps.add( new CalibrationStep( "seed" )
		{
			@Override
			public SpectralCube run( final SpectralCube current, final CalibrationOutcome outcome )
			{
				return scan;
			}
		} );
		steps.add( applyReferenceStep( black, CalibrationStage.BLACKREF_APPLIED ) );
		steps.add( applyReferenceStep( white, CalibrationStage.WHITEREF_APPLIED ) );
		steps.add( new CalibrationStep( "preprocessing" )
		{
			@Override
			public SpectralCube run( final SpectralCube current, final CalibrationOutcome outcome )
			{
				return preprocess( current, outcome );
			}
		} );

		final CalibrationStep.Result result = CalibrationStep.runAll( steps, outcome );

		if ( result.isSuccess() )
			LOG.info( "Calculation: done!" );

		normData = result.getCube();

		if ( normData != null )
			outcome.put( CalibrationStage.DIMENSIONS_DIFFER, !Cubes.sameShape( scan.getData(), normData.getData() ) );

		return outcome;
	}

	protected CalibrationStep initReferenceDataStep( final ReferenceSlot slot, final CalibrationStage stage )
	{
		return new CalibrationStep( "init " + slot.getType().getLabel() + " reference data" )
		{
			@Override
			public SpectralCube run( final SpectralCube current, final CalibrationOutcome outcome ) throws IOException
			{
				if ( slot.canInitData() )
				{
					outcome.put( stage, false );
					LOG.info( "Initializing {} reference data: {}", slot.getType().getLabel(), slot.getLocator() );
					initReferenceData( slot );
					outcome.put( stage, true );
				}

				return current;
			}
		};
	}

	/**
	 * Runs the locator of the slot according to its capability.
	 */
	protected void initReferenceData( final ReferenceSlot slot ) throws IOException
	{
		final String label = slot.getType().getLabel();

		switch ( slot.locator.getCapability() )
		{
			case FILE_BASED:
			{
				if ( scanFile == null )
					break;

				final FileBasedReferenceLocator locator = (FileBasedReferenceLocator)slot.locator;
				locator.setBaseFile( scanFile );
				final String ref = locator.locate();

				if ( ref != null )
				{
					LOG.info( "Using {} reference file: {}", label, ref );
					readReference( slot, ref );
				}

				break;
			}
			case ANNOTATION_BASED:
			{
				final ObjectPredictions annotations = contours.toObjectPredictions( scan.width(), scan.height() );

				if ( annotations == null )
					break;

				final AnnotationBasedReferenceLocator locator = (AnnotationBasedReferenceLocator)slot.locator;
				locator.setAnnotations( annotations );
				final ObjectPrediction ref = locator.locate();

				if ( ref != null )
				{
					if ( ref.getBBox() == null )
						throw new CalibrationException( "Located " + label + " reference annotation has no bounding box: " + ref.getLabel() );

					final AnnotationRectangle annotation = AnnotationRectangle.fromBBox( ref.getBBox() );
					LOG.info( "Using {} reference annotation: {}", label, annotation );
					slot.setAnnotation( annotation, true );
				}

				break;
			}
			default:
			{
				final Object ref = slot.locator.locate();

				if ( ref == null )
					break;

				if ( !( ref instanceof String ) )
					throw new CalibrationException( "Unhandled output of " + label + " reference locator " + slot.locator.getName() + ": " + ref.getClass().getName() );

				LOG.info( "Using {} reference file: {}", label, ref );
				readReference( slot, (String)ref );
			}
		}
	}

	protected CalibrationStep applyReferenceStep( final ReferenceSlot slot, final CalibrationStage stage )
	{
		return new CalibrationStep( "apply " + slot.getType().getLabel() + " reference" )
		{
			@Override
			public SpectralCube run( final SpectralCube current, final CalibrationOutcome outcome )
			{
				return applyReference( slot, stage, current, outcome );
			}
		};
	}

	protected SpectralCube applyReference( final ReferenceSlot slot, final CalibrationStage stage, final SpectralCube current, final CalibrationOutcome outcome )
	{
		final ReferenceMethod< ? > method = slot.method;
		final String label = slot.getType().getLabel();

		if ( method == null )
			return current;

		if ( method.getCapability() == ReferenceMethod.Capability.ANNOTATION_BASED )
		{
			if ( slot.annotation == null )
			{
				LOG.warn( "No annotations available, cannot apply {} reference method: {}", label, method );
				return current;
			}

			outcome.put( stage, false );
			method.setReference( slot.annotationInScan ? scan.getData() : slot.data );
			( (AnnotationBasedReferenceMethod< ? >)method ).setAnnotation( slot.annotation );
		}
		else if ( slot.data != null )
		{
			outcome.put( stage, false );
			method.setReference( slot.data );
		}
		else
		{
			return current;
		}

		LOG.info( "Applying {} reference method: {}", label, method );
		final SpectralCube result = current.copy( method.apply( current.getData() ) );
		outcome.put( stage, true );

		return result;
	}

	protected SpectralCube preprocess( final SpectralCube current, final CalibrationOutcome outcome )
	{
		if ( preprocessor == null )
			return current;

		LOG.info( "Applying preprocessing: {}", preprocessor );
		outcome.put( CalibrationStage.PREPROCESSORS_APPLIED, false );

		if ( contours.hasAnnotations() )
			attachAnnotations( preprocessor, contours.toObjectPredictions( scan.width(), scan.height() ) );

		preprocessor.fit( current );
		final List< SpectralCube > output = preprocessor.apply( current );

		SpectralCube result = current;

		if ( output.size() == 1 )
		{
			result = output.get( 0 );

			if ( !result.hasWavelengths() )
				result = result.copy( result.getData(), indexWavelengths( result.numBands() ) );
		}
		else
		{
			LOG.warn( "Preprocessing: preprocessors did not generate just a single output, but: {}", output.size() );
		}

		outcome.put( CalibrationStage.PREPROCESSORS_APPLIED, true );

		return result;
	}

	protected static void attachAnnotations( final Preprocessor preprocessor, final ObjectPredictions annotations )
	{
		if ( preprocessor instanceof AnnotationAware )
			( (AnnotationAware)preprocessor ).setAnnotations( annotations );

		if ( preprocessor instanceof MultiPreprocessor )
			for ( final Preprocessor p : ( (MultiPreprocessor)preprocessor ).getPreprocessors() )
				attachAnnotations( p, annotations );
	}

	protected static List< Double > indexWavelengths( final int numBands )
	{
		final ArrayList< Double > wavelengths = new ArrayList<>();

		for ( int i = 0; i < numBands; ++i )
			wavelengths.add( (double)i );

		return wavelengths;
	}

	/**
	 * @param outcome - the outcome of {@link #calcNormData()}
	 * @return compact status string, e.g. "I:✔ B:✔ W:❌"
	 */
	public static String calcNormDataIndicator( final CalibrationOutcome outcome )
	{
		return outcome.indicator();
	}

	/*
	 * display
	 */

	public Img< UnsignedByteType > getDisplayImage() { return displayImage; }

	/**
	 * Calculates the calibrated data if necessary and updates the display image. Band indices are clamped
	 * to the bands of the calibrated data. If the normalization fails, the raw bands are displayed.
	 *
	 * @param r - the band for the red channel
	 * @param g - the band for the green channel
	 * @param b - the band for the blue channel
	 * @return the outcome of {@link #calcNormData()}
	 */
	public CalibrationOutcome updateImage( final int r, final int g, final int b )
	{
		if ( scan == null )
			return new CalibrationOutcome();

		final CalibrationOutcome outcome = calcNormData();

		if ( normData == null )
			return outcome;

		final int[] indices = new int[]{ clampBand( r ), clampBand( g ), clampBand( b ) };
		final List< RandomAccessibleInterval< FloatType > > raw = new ArrayList<>();

		for ( final int index : indices )
			raw.add( normData.band( index ) );

		List< RandomAccessibleInterval< FloatType > > bands = raw;

		if ( normalization != null )
		{
			LOG.info( "Applying normalization: {}", normalization );

			if ( normalization instanceof AnnotationBasedNormalization )
				( (AnnotationBasedNormalization)normalization ).setAnnotations( contours.toObjectPredictions( normData.width(), normData.height() ) );

			try
			{
				final List< RandomAccessibleInterval< FloatType > > normalized = new ArrayList<>();

				for ( int c = 0; c < 3; ++c )
					normalized.add( normalization.normalize( raw.get( c ), Channel.values()[ c ] ) );

				bands = normalized;
			}
			catch ( final RuntimeException e )
			{
				LOG.warn( "Failed to normalize image using r=" + indices[ 0 ] + ", g=" + indices[ 1 ] + ", b=" + indices[ 2 ] + ": " + e.getMessage(), e );
			}
		}

		displayImage = DisplayImage.toDisplayImage( bands );

		return outcome;
	}

	protected int clampBand( final int band )
	{
		return Math.max( 0, Math.min( band, normData.numBands() - 1 ) );
	}

	/**
	 * Updates the display image and writes it to a file.
	 *
	 * @param r - the band for the red channel
	 * @param g - the band for the green channel
	 * @param b - the band for the blue channel
	 * @param path - the output file
	 * @param width - the output width, the natural width if &lt;= 0
	 * @param height - the output height, the natural height if &lt;= 0
	 * @throws IOException if writing fails
	 */
	public void outputImage( final int r, final int g, final int b, final String path, final int width, final int height ) throws IOException
	{
		updateImage( r, g, b );

		if ( displayImage == null )
			throw new CalibrationException( "No display image available, " + ( hasScan() ? "calculation failed." : "load a scan first." ) );

		DisplayImage.save( displayImage, path, width, height );
	}

	/*
	 * diagnostics
	 */

	/**
	 * @return min/max of scan, black and white reference (where present)
	 */
	public Map< String, Double > statistics()
	{
		final LinkedHashMap< String, Double > result = new LinkedHashMap<>();

		if ( scan != null )
			addMinMax( result, "scan", scan.getData() );

		if ( black.hasData() )
			addMinMax( result, "blackref", black.getData() );

		if ( white.hasData() )
			addMinMax( result, "whiteref", white.getData() );

		return result;
	}

	private static void addMinMax( final Map< String, Double > result, final String prefix, final RandomAccessibleInterval< FloatType > data )
	{
		final double[] minmax = Cubes.minMax( data );
		result.put( prefix + ".min", minmax[ 0 ] );
		result.put( prefix + ".max", minmax[ 1 ] );
	}

	/**
	 * @return textual description of the current state
	 */
	public String dumpState()
	{
		final StringBuilder s = new StringBuilder();

		s.append( "scan file: " ).append( scanFile ).append( '\n' );

		if ( scan != null )
			s.append( "scan shape: " ).append( Cubes.printShape( scan.getData() ) ).append( '\n' );

		for ( final ReferenceSlot slot : new ReferenceSlot[]{ black, white } )
		{
			final String prefix = slot.getType().getLabel() + " reference";
			s.append( prefix ).append( " locator: " ).append( slot.getLocator() ).append( '\n' );
			s.append( prefix ).append( " method: " ).append( slot.getMethod() ).append( '\n' );
			s.append( prefix ).append( " file: " ).append( slot.getFile() ).append( '\n' );

			if ( slot.hasData() )
				s.append( prefix ).append( " shape: " ).append( Cubes.printShape( slot.getData() ) ).append( '\n' );

			if ( slot.getAnnotation() != null )
				s.append( prefix ).append( " annotation: " ).append( slot.getAnnotation() ).append( slot.isAnnotationInScan() ? " (scan)" : " (reference)" ).append( '\n' );
		}

		s.append( "preprocessing: " ).append( preprocessor ).append( '\n' );
		s.append( "normalization: " ).append( normalization ).append( '\n' );

		if ( normData != null )
			s.append( "calibrated shape: " ).append( Cubes.printShape( normData.getData() ) ).append( '\n' );

		for ( final Map.Entry< String, Double > e : statistics().entrySet() )
			s.append( e.getKey() ).append( ": " ).append( e.getValue() ).append( '\n' );

		final List< Double > wavelengths = getWavelengths();

		if ( !wavelengths.isEmpty() )
		{
			s.append( "wavelengths:\n" );

			for ( int i = 0; i < wavelengths.size(); ++i )
				s.append( "  " ).append( i ).append( ": " ).append( wavelengths.get( i ) ).append( '\n' );
		}

		return s.toString();
	}
}
