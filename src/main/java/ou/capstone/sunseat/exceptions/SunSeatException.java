package ou.capstone.sunseat.exceptions;

public class SunSeatException extends Exception
{
    public SunSeatException( final Exception e )
    {
        super( e );
    }

    public SunSeatException( final String msg )
    {
        super( msg );
    }

    public SunSeatException( final String msg, final Exception e )
    {
        super( msg, e );
    }
}
